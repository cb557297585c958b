package com.planwatch.core.summary;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads summaries written by {@link SummaryEmitter}.
 */
@Service
public class ReportReader {

    private final ObjectMapper objectMapper;

    public ReportReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public SummaryArtifact read(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ReportReadException("No such report: " + file, null);
        }
        try {
            return objectMapper.readValue(file.toFile(), SummaryArtifact.class);
        } catch (IOException e) {
            throw new ReportReadException("Cannot read report " + file + ": " + e.getMessage(), e);
        }
    }
}
