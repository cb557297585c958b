package com.planwatch.core.summary;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.planwatch.core.model.TerminationReason;
import com.planwatch.core.model.TestPlan;
import com.planwatch.core.session.MonitorSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;

/**
 * Writes the final session summary to {@code ai-analysis-<correlationId>.json}.
 * <p>
 * The file is first written next to its destination and then moved into place, so a
 * crash mid-write leaves at most a stray temp file, never a truncated artifact.
 * Each session writes its own file, so runs never collide.
 */
@Service
public class SummaryEmitter {

    private static final Logger log = LoggerFactory.getLogger(SummaryEmitter.class);

    static final String FILE_PREFIX = "ai-analysis-";
    static final String FILE_SUFFIX = ".json";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public SummaryEmitter(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
        this.clock = clock;
    }

    public SummaryEmitter(ObjectMapper objectMapper) {
        this(objectMapper, Clock.systemUTC());
    }

    public static Path artifactPath(Path outputDir, String correlationId) {
        return outputDir.resolve(FILE_PREFIX + correlationId + FILE_SUFFIX);
    }

    /**
     * Snapshots the session and persists it.
     *
     * @return the artifact that was written
     * @throws UncheckedIOException if the file cannot be written
     */
    public WrittenSummary emit(MonitorSession session, Path outputDir) {
        Duration elapsed = session.elapsed(clock.instant());
        SummaryArtifact artifact = snapshot(session, elapsed);
        Path target = artifactPath(outputDir, session.correlationId());
        write(artifact, target);
        log.info("Summary for workflow {} written to {} ({} thoughts, {} findings, {}s)",
                session.correlationId(), target, artifact.thoughtLog().size(),
                artifact.findings().size(), artifact.duration());
        return new WrittenSummary(artifact, target, elapsed);
    }

    SummaryArtifact snapshot(MonitorSession session, Duration elapsed) {
        return new SummaryArtifact(
                session.correlationId(),
                elapsed.toMillis() / 1000.0,
                session.terminationReason().map(TerminationReason::name).orElse(null),
                session.thoughtLog(),
                session.plan().map(TestPlan::payload).orElse(null),
                session.findings());
    }

    private void write(SummaryArtifact artifact, Path target) {
        Path temp = null;
        try {
            Path dir = target.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            temp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
            objectMapper.writeValue(temp.toFile(), artifact);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported in {}, replacing non-atomically", dir);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new UncheckedIOException("Failed to write summary " + target, e);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.debug("Could not remove temp file {}: {}", temp, e.getMessage());
        }
    }

    /**
     * Result of {@link #emit}: what was written, where, and the elapsed time it reports.
     */
    public record WrittenSummary(SummaryArtifact artifact, Path path, Duration elapsed) {}
}
