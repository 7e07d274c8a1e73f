package io.phaseline.error;

import java.util.LinkedHashMap;
import java.util.Map;

public final class StepMismatchException extends PipelineException {
    private final String expected;
    private final String received;

    public StepMismatchException(String expected, String received) {
        super(ErrorKind.MISMATCH, "Step mismatch: expected " + expected + ", got " + received);
        this.expected = expected;
        this.received = received;
    }

    public String expected() {
        return expected;
    }

    public String received() {
        return received;
    }

    @Override
    public Map<String, Object> details() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("expected", expected);
        out.put("got", received);
        out.put("suggestion", "Run 'next' to see the current step");
        return out;
    }
}
