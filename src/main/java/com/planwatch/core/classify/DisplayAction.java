package com.planwatch.core.classify;

import com.planwatch.core.model.Finding;
import com.planwatch.core.model.Severity;
import com.planwatch.core.model.TestPlan;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * What the monitor wants shown, independent of how it is drawn.
 * Placeholders for missing engine fields are already applied.
 */
public interface DisplayAction {

    String UNKNOWN = "Unknown";
    String NOT_AVAILABLE = "N/A";

    String NOT_SPECIFIED = "Not specified";

    /** Maximum display width of a plan step's target. */
    int TARGET_WIDTH = 30;

    static DisplayAction none() {
        return Nothing.INSTANCE;
    }

    enum Nothing implements DisplayAction {
        INSTANCE
    }

    record RequestPanel(String correlationId, String target, String scope, String objective)
            implements DisplayAction {}

    record ThoughtPanel(String phase, String text) implements DisplayAction {}

    /**
     * @param rows      one row per recommendation
     * @param reasoning engine reasoning text
     */
    record StrategyTable(List<StrategyRow> rows, String reasoning) implements DisplayAction {

        public StrategyTable {
            rows = List.copyOf(rows);
        }

        public record StrategyRow(String phase, String action, String priority) {}
    }

    /**
     * @param intent     classified intent
     * @param confidence confidence as a fraction in [0, 1]
     */
    record ClassificationPanel(String intent, double confidence) implements DisplayAction {

        public String confidencePercent() {
            return String.format(Locale.ROOT, "%.2f%%", confidence * 100);
        }
    }

    /**
     * @param rows      numbered step rows
     * @param firstStep the step to highlight, null when the plan is empty
     */
    record PlanTable(List<PlanRow> rows, FirstStep firstStep) implements DisplayAction {

        public PlanTable {
            rows = List.copyOf(rows);
        }

        public record PlanRow(int index, String tool, String target, String purpose) {}

        public record FirstStep(String tool, String purpose, String priority) {

            static FirstStep of(TestPlan.PlanStep step) {
                return new FirstStep(
                        orDefault(step.tool(), UNKNOWN),
                        orDefault(step.purpose(), NOT_AVAILABLE),
                        orDefault(step.priority(), NOT_SPECIFIED));
            }
        }

        public static PlanTable of(TestPlan plan) {
            List<PlanRow> rows = new ArrayList<>();
            int index = 1;
            for (TestPlan.PlanStep step : plan.steps()) {
                String target = step.target() != null ? step.target()
                        : plan.target() != null ? plan.target() : NOT_AVAILABLE;
                rows.add(new PlanRow(index++,
                        orDefault(step.tool(), UNKNOWN),
                        truncate(target, TARGET_WIDTH),
                        orDefault(step.purpose(), NOT_AVAILABLE)));
            }
            return new PlanTable(rows, plan.hasSteps() ? FirstStep.of(plan.steps().get(0)) : null);
        }

        public boolean hasFirstStep() {
            return firstStep != null;
        }
    }

    record PhaseBanner(String phase) implements DisplayAction {}

    record FindingPanel(String type, String description, String impact, String severityLabel, Severity severity)
            implements DisplayAction {

        public static FindingPanel of(Finding finding) {
            return new FindingPanel(
                    orDefault(finding.type(), UNKNOWN),
                    orDefault(finding.description(), NOT_AVAILABLE),
                    orDefault(finding.impact(), NOT_AVAILABLE),
                    finding.severity().toUpperCase(Locale.ROOT),
                    finding.severityLevel());
        }
    }

    record CompletionBanner(String correlationId) implements DisplayAction {}

    record ErrorPanel(String title, String message) implements DisplayAction {}

    record StatusLine(String message) implements DisplayAction {}

    record SummaryPanel(String correlationId, double durationSeconds, int thoughtCount, int findingCount,
                        boolean planGenerated, String terminationReason, Path artifact) implements DisplayAction {}

    static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    static String truncate(String value, int width) {
        if (value == null) {
            return NOT_AVAILABLE;
        }
        return value.length() <= width ? value : value.substring(0, width);
    }
}
