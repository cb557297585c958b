package com.planwatch.dispatch.cli;

import com.planwatch.core.classify.DisplayAction;
import com.planwatch.core.model.Finding;
import com.planwatch.core.model.TestPlan;
import com.planwatch.core.model.ThoughtEntry;
import com.planwatch.core.summary.ReportReadException;
import com.planwatch.core.summary.ReportReader;
import com.planwatch.core.summary.SummaryArtifact;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: planwatch report &lt;file&gt;
 * <p>
 * Renders a summary file written by {@code run}: totals, the last plan and every finding.
 */
@Command(name = "report", mixinStandardHelpOptions = true, description = "Render a saved analysis summary")
@Component
public class ReportCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Path to an ai-analysis-<id>.json file")
    private Path file;

    @Option(names = "--thoughts", description = "Also print the captured reasoning log")
    private boolean showThoughts;

    private final ReportReader reportReader;

    public ReportCommand(ReportReader reportReader) {
        this.reportReader = reportReader;
    }

    @Override
    public Integer call() {
        SummaryArtifact report;
        try {
            report = reportReader.read(file);
        } catch (ReportReadException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        ConsoleRenderer renderer = new ConsoleRenderer(System.out);
        renderer.render(new DisplayAction.SummaryPanel(
                report.correlationId(), report.duration(), report.thoughtLog().size(),
                report.findings().size(), report.plan() != null,
                report.terminationReason() != null ? report.terminationReason() : DisplayAction.UNKNOWN,
                file));

        if (showThoughts) {
            for (ThoughtEntry thought : report.thoughtLog()) {
                renderer.render(new DisplayAction.ThoughtPanel(thought.phase(), thought.text()));
            }
        }

        if (report.plan() != null) {
            renderer.render(DisplayAction.PlanTable.of(TestPlan.fromPayload(report.plan())));
        }

        if (report.findings().isEmpty()) {
            ConsoleOutput.info("No findings recorded.");
        }
        for (Finding finding : report.findings()) {
            renderer.render(DisplayAction.FindingPanel.of(finding));
        }
        return 0;
    }
}
