package io.phaseline.model;

/**
 * Where an effective pipeline index points: the static catalog or the session's generated
 * dynamic-phase list. {@code index} is the position inside that source.
 */
public record StepRef(Source source, int index) {
    public enum Source {
        STATIC,
        GENERATED
    }

    public static StepRef ofStatic(int index) {
        return new StepRef(Source.STATIC, index);
    }

    public static StepRef generated(int index) {
        return new StepRef(Source.GENERATED, index);
    }

    public boolean isGenerated() {
        return source == Source.GENERATED;
    }
}
