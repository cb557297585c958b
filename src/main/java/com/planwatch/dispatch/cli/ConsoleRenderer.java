package com.planwatch.dispatch.cli;

import com.planwatch.core.classify.DisplayAction;
import com.planwatch.core.classify.DisplayAction.ClassificationPanel;
import com.planwatch.core.classify.DisplayAction.CompletionBanner;
import com.planwatch.core.classify.DisplayAction.ErrorPanel;
import com.planwatch.core.classify.DisplayAction.FindingPanel;
import com.planwatch.core.classify.DisplayAction.PhaseBanner;
import com.planwatch.core.classify.DisplayAction.PlanTable;
import com.planwatch.core.classify.DisplayAction.RequestPanel;
import com.planwatch.core.classify.DisplayAction.StatusLine;
import com.planwatch.core.classify.DisplayAction.StrategyTable;
import com.planwatch.core.classify.DisplayAction.SummaryPanel;
import com.planwatch.core.classify.DisplayAction.ThoughtPanel;
import com.planwatch.core.classify.DisplayRenderer;
import com.planwatch.core.model.Severity;
import picocli.CommandLine.Help.Ansi;

import java.io.PrintStream;

/**
 * Draws display actions on the terminal.
 * <p>
 * Rendering is synchronized: the dispatch and listener threads both report here and
 * a panel is never interleaved with another.
 */
public class ConsoleRenderer implements DisplayRenderer {

    private static final String RULE = "──────────────────────────────────";

    private final PrintStream out;
    private final Ansi ansi;

    public ConsoleRenderer(PrintStream out, Ansi ansi) {
        this.out = out;
        this.ansi = ansi;
    }

    public ConsoleRenderer(PrintStream out) {
        this(out, Ansi.AUTO);
    }

    @Override
    public synchronized void render(DisplayAction action) {
        if (action instanceof RequestPanel p) {
            header("Security Test Request", "bold,fg(cyan)");
            out.println("  Workflow ID: " + p.correlationId());
            out.println("  Target:      " + p.target());
            out.println("  Scope:       " + p.scope());
            out.println("  Objective:   " + p.objective());
            out.println(RULE);
        } else if (action instanceof ThoughtPanel p) {
            out.println(styled("fg(magenta)", "[AI THINKING]") + " " + styled("bold", p.phase()));
            out.println("  " + p.text());
        } else if (action instanceof StrategyTable p) {
            header("AI Strategy", "bold,fg(magenta)");
            out.printf("  %-16s %-40s %-8s%n", "Phase", "Action", "Priority");
            for (StrategyTable.StrategyRow row : p.rows()) {
                out.printf("  %-16s %-40s %-8s%n", row.phase(), row.action(), row.priority());
            }
            out.println("  Reasoning: " + p.reasoning());
        } else if (action instanceof ClassificationPanel p) {
            out.println(styled("fg(blue)", "[CLASSIFICATION]") + " Intent: " + p.intent()
                    + " | Confidence: " + p.confidencePercent());
        } else if (action instanceof PlanTable p) {
            header("Test Plan", "bold,fg(green)");
            out.printf("  %-3s %-16s %-30s %s%n", "#", "Tool", "Target", "Purpose");
            for (PlanTable.PlanRow row : p.rows()) {
                out.printf("  %-3d %-16s %-30s %s%n", row.index(), row.tool(), row.target(), row.purpose());
            }
            if (p.hasFirstStep()) {
                PlanTable.FirstStep first = p.firstStep();
                out.println(styled("bold,fg(yellow)", "  First step"));
                out.println("    Action:   " + first.tool());
                out.println("    Purpose:  " + first.purpose());
                out.println("    Priority: " + first.priority());
            }
        } else if (action instanceof PhaseBanner p) {
            out.println(styled("bold,fg(yellow)", ">> " + p.phase()));
        } else if (action instanceof FindingPanel p) {
            String style = "bold," + colorStyle(p.severity());
            out.println(styled(style, "[" + p.severityLabel() + "]") + " " + styled("bold", p.type()));
            out.println("  Description: " + p.description());
            out.println("  Impact:      " + p.impact());
        } else if (action instanceof CompletionBanner p) {
            out.println(styled("bold,fg(green)", "Workflow complete") + " " + p.correlationId());
        } else if (action instanceof ErrorPanel p) {
            out.println(styled("bold,fg(red)", "[ERROR] " + p.title()));
            out.println("  " + p.message());
        } else if (action instanceof StatusLine p) {
            out.println(styled("fg(cyan)", "[PLANWATCH]") + " " + p.message());
        } else if (action instanceof SummaryPanel p) {
            header("Analysis Summary", "bold,fg(cyan)");
            out.println("  Workflow ID:    " + p.correlationId());
            out.println("  Duration:       " + ConsoleOutput.formatDuration(p.durationSeconds()));
            out.println("  Thoughts:       " + p.thoughtCount());
            out.println("  Findings:       " + p.findingCount());
            out.println("  Plan generated: " + (p.planGenerated() ? "yes" : "no"));
            out.println("  Ended by:       " + p.terminationReason());
            if (p.artifact() != null) {
                out.println("  Saved to:       " + p.artifact());
            }
            out.println(RULE);
        }
        out.flush();
    }

    /**
     * Maps a severity's display color onto a picocli style. Orange has no 16-color
     * equivalent and uses the 256-color palette.
     */
    static String colorStyle(Severity severity) {
        return switch (severity) {
            case HIGH -> "fg(208)";
            default -> "fg(" + severity.color() + ")";
        };
    }

    private void header(String title, String style) {
        out.println(RULE);
        out.println(styled(style, title));
    }

    /**
     * Engine text may contain markup delimiters, so only clean text is wrapped.
     */
    private String styled(String style, String text) {
        if (text == null || text.contains("@|") || text.contains("|@")) {
            return String.valueOf(text);
        }
        return ansi.string("@|" + style + " " + text + "|@");
    }
}
