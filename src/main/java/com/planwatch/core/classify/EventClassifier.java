package com.planwatch.core.classify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.planwatch.core.events.EventType;
import com.planwatch.core.events.RawEvent;
import com.planwatch.core.model.Finding;
import com.planwatch.core.model.TerminationReason;
import com.planwatch.core.model.TestPlan;
import com.planwatch.core.model.ThoughtEntry;
import com.planwatch.core.session.MonitorSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps each raw event to its semantic case, applies the case's session mutation
 * and returns what should be displayed.
 * <p>
 * The only component that writes the thought log, plan, findings and phase.
 * Unknown discriminators are a no-op so newer engines cannot crash the monitor.
 */
@Component
public class EventClassifier {

    private static final Logger log = LoggerFactory.getLogger(EventClassifier.class);

    static final String DEFAULT_THOUGHT_PHASE = "general";
    static final String DEFAULT_PRIORITY = "medium";
    static final String DEFAULT_REASONING = "No reasoning provided";

    private final Clock clock;

    @Autowired
    public EventClassifier(Clock clock) {
        this.clock = clock;
    }

    public EventClassifier() {
        this(Clock.systemUTC());
    }

    public DisplayAction classify(RawEvent event, MonitorSession session) {
        EventType type = EventType.fromWire(event.type());
        log.debug("Classifying {} as {}", event.type(), type);

        return switch (type) {
            case THINKING -> thinking(event, session);
            case STRATEGY -> strategy(event);
            case CLASSIFICATION -> classification(event);
            case PLAN -> plan(event, session);
            case TEST_START -> testStart(event, session);
            case FINDING -> finding(event, session);
            case WORKFLOW_COMPLETE -> workflowComplete(session);
            case ERROR -> new DisplayAction.ErrorPanel("Engine error",
                    event.text("message", event.text("error", "No details provided")));
            case CONNECTED, SUBSCRIBED -> new DisplayAction.StatusLine(
                    event.text("message", "Event channel " + event.type()));
            case UNRECOGNIZED -> DisplayAction.none();
        };
    }

    private DisplayAction thinking(RawEvent event, MonitorSession session) {
        String phase = event.text("phase", DEFAULT_THOUGHT_PHASE);
        String content = event.text("content", "");
        session.appendThought(new ThoughtEntry(clock.instant(), phase, content));
        return new DisplayAction.ThoughtPanel(phase, content);
    }

    private DisplayAction strategy(RawEvent event) {
        JsonNode strategy = event.field("strategy");
        String phase = textOr(strategy, "phase", DisplayAction.NOT_AVAILABLE);
        List<DisplayAction.StrategyTable.StrategyRow> rows = new ArrayList<>();
        for (JsonNode rec : strategy.path("recommendations")) {
            rows.add(new DisplayAction.StrategyTable.StrategyRow(
                    phase,
                    textOr(rec, "tool", DisplayAction.UNKNOWN) + ": " + textOr(rec, "purpose", ""),
                    textOr(rec, "priority", DEFAULT_PRIORITY)));
        }
        return new DisplayAction.StrategyTable(rows, event.text("reasoning", DEFAULT_REASONING));
    }

    private DisplayAction classification(RawEvent event) {
        String intent = event.text("intent", DisplayAction.UNKNOWN);
        JsonNode confidence = event.field("confidence");
        return new DisplayAction.ClassificationPanel(intent, confidence.isNumber() ? confidence.asDouble() : 0.0);
    }

    private DisplayAction plan(RawEvent event, MonitorSession session) {
        JsonNode payload = event.field("plan");
        if (!payload.isObject()) {
            payload = JsonNodeFactory.instance.objectNode();
        }
        TestPlan plan = TestPlan.fromPayload(payload);
        session.replacePlan(plan);
        return DisplayAction.PlanTable.of(plan);
    }

    private DisplayAction testStart(RawEvent event, MonitorSession session) {
        String phase = "Running: " + event.text("test", DisplayAction.UNKNOWN);
        session.setPhase(phase);
        return new DisplayAction.PhaseBanner(phase);
    }

    private DisplayAction finding(RawEvent event, MonitorSession session) {
        Finding finding = Finding.fromPayload(event.payload());
        session.appendFinding(finding);
        return DisplayAction.FindingPanel.of(finding);
    }

    private DisplayAction workflowComplete(MonitorSession session) {
        if (!session.terminate(TerminationReason.WORKFLOW_COMPLETE)) {
            log.debug("workflow:complete after session already terminated ({})",
                    session.terminationReason().orElse(null));
        }
        return new DisplayAction.CompletionBanner(session.correlationId());
    }

    private static String textOr(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return fallback;
        }
        return RawEvent.asText(value);
    }
}
