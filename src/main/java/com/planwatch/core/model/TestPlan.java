package com.planwatch.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * The engine's test execution plan, replaced wholesale whenever a new plan arrives.
 * <p>
 * Steps come from {@code steps} when that array is non-empty, otherwise from
 * {@code recommendations}; a payload with neither yields an empty step list.
 *
 * @param steps   ordered plan steps
 * @param target  plan-level target used when a step names none (nullable)
 * @param payload the plan object exactly as received, persisted in the summary
 */
public record TestPlan(
    List<PlanStep> steps,
    String target,
    JsonNode payload
) {

    public TestPlan {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    /**
     * A single planned tool invocation.
     *
     * @param tool     tool name ({@code name} is accepted as an alias)
     * @param target   what the tool runs against
     * @param purpose  why ({@code description} is accepted as an alias)
     * @param priority engine priority label, nullable
     */
    public record PlanStep(
        String tool,
        String target,
        String purpose,
        String priority
    ) {

        static PlanStep fromPayload(JsonNode step) {
            String tool = Finding.textOrNull(step, "tool");
            if (tool == null) {
                tool = Finding.textOrNull(step, "name");
            }
            String purpose = Finding.textOrNull(step, "purpose");
            if (purpose == null) {
                purpose = Finding.textOrNull(step, "description");
            }
            return new PlanStep(tool, Finding.textOrNull(step, "target"), purpose,
                    Finding.textOrNull(step, "priority"));
        }
    }

    public static TestPlan fromPayload(JsonNode payload) {
        JsonNode source = payload.path("steps");
        if (!source.isArray() || source.isEmpty()) {
            source = payload.path("recommendations");
        }
        List<PlanStep> steps = new ArrayList<>();
        if (source.isArray()) {
            for (JsonNode step : source) {
                steps.add(PlanStep.fromPayload(step));
            }
        }
        return new TestPlan(steps, Finding.textOrNull(payload, "target"), payload);
    }

    public boolean hasSteps() {
        return !steps.isEmpty();
    }
}
