package io.phaseline.cli;

import io.phaseline.error.ErrorKind;
import io.phaseline.error.PipelineException;
import io.phaseline.util.Jsons;
import picocli.CommandLine;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders any command failure as one JSON object on stderr and exits 1.
 */
final class JsonErrorReporter implements CommandLine.IExecutionExceptionHandler {
    @Override
    public int handleExecutionException(Exception ex, CommandLine commandLine, CommandLine.ParseResult parseResult) {
        System.err.println(Jsons.toJson(describe(ex)));
        return 1;
    }

    static Map<String, Object> describe(Throwable ex) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (ex instanceof PipelineException) {
            PipelineException pe = (PipelineException) ex;
            body.put("error", pe.getMessage());
            body.put("kind", pe.kind().tag());
            for (Map.Entry<String, Object> e : pe.details().entrySet()) {
                body.putIfAbsent(e.getKey(), e.getValue());
            }
            return body;
        }
        body.put("error", ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage());
        body.put("kind", ex instanceof IllegalArgumentException
                ? ErrorKind.INVALID_REQUEST.tag()
                : ErrorKind.INTERNAL.tag());
        return body;
    }
}
