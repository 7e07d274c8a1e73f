package io.phaseline.daemon;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.phaseline.error.ErrorKind;
import io.phaseline.error.PipelineException;
import io.phaseline.model.CoverageGrade;
import io.phaseline.runtime.Orchestrator;
import io.phaseline.util.Jsons;

import java.util.Set;

/**
 * Maps session-lifecycle method names onto the bundle's orchestrator. Used by the daemon and by
 * the CLI when it runs in-process.
 */
public final class RequestDispatcher {
    public static final Set<String> METHODS = Set.of(
            "init", "next", "complete", "status", "list", "resume", "abort",
            "checkpoints", "rollback", "purge", "toolUsage", "coverage"
    );

    public boolean handles(String method) {
        return method != null && METHODS.contains(method);
    }

    public JsonNode dispatch(WarmBundle bundle, String method, JsonNode params) {
        JsonNode p = params == null ? NullNode.getInstance() : params;
        Orchestrator orchestrator = bundle.orchestrator();
        Object outcome;
        switch (method) {
            case "init":
                outcome = orchestrator.init(requireText(p, "query"), optionalText(p, "mode"));
                break;
            case "next":
                outcome = orchestrator.next(requireText(p, "sessionId"));
                break;
            case "complete":
                JsonNode output = p.get("output");
                outcome = orchestrator.complete(
                        requireText(p, "sessionId"),
                        requireText(p, "stepKey"),
                        output == null || output.isNull() ? null : output
                );
                break;
            case "status":
                outcome = orchestrator.status(requireText(p, "sessionId"));
                break;
            case "list":
                outcome = orchestrator.list(p.path("all").asBoolean(false));
                break;
            case "resume":
                outcome = orchestrator.resume(requireText(p, "sessionId"));
                break;
            case "abort":
                outcome = orchestrator.abort(requireText(p, "sessionId"));
                break;
            case "checkpoints":
                outcome = orchestrator.checkpoints(requireText(p, "sessionId"));
                break;
            case "rollback":
                outcome = orchestrator.rollback(requireText(p, "sessionId"), optionalText(p, "checkpointId"));
                break;
            case "purge":
                outcome = orchestrator.purge(p.path("olderThanDays").asInt(0));
                break;
            case "toolUsage":
                outcome = orchestrator.recordToolUsage(
                        requireText(p, "sessionId"),
                        requireText(p, "stepKey"),
                        requireText(p, "tool"),
                        optionalText(p, "justification")
                );
                break;
            case "coverage":
                outcome = orchestrator.updateCoverage(requireText(p, "sessionId"), parseGrade(requireText(p, "grade")));
                break;
            default:
                throw new PipelineException(ErrorKind.INVALID_REQUEST, "Unknown method: " + method);
        }
        return Jsons.mapper().valueToTree(outcome);
    }

    private static CoverageGrade parseGrade(String raw) {
        try {
            return CoverageGrade.parse(raw);
        } catch (IllegalArgumentException e) {
            throw new PipelineException(ErrorKind.INVALID_REQUEST, e.getMessage());
        }
    }

    private static String requireText(JsonNode params, String field) {
        JsonNode value = params.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new PipelineException(ErrorKind.INVALID_REQUEST, "Missing parameter: " + field);
        }
        return value.asText();
    }

    private static String optionalText(JsonNode params, String field) {
        JsonNode value = params.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
