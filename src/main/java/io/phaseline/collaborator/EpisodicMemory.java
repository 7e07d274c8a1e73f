package io.phaseline.collaborator;

/**
 * Cross-session memory of finished steps. Callers treat every method as best-effort.
 */
public interface EpisodicMemory {
    InjectionResult inject(String prompt, InjectionOptions options);

    void store(Episode episode);

    record InjectionOptions(String sessionId, String stepKey, int window) {
    }

    record InjectionResult(String augmentedPrompt, int used) {
        public static InjectionResult unchanged(String prompt) {
            return new InjectionResult(prompt, 0);
        }
    }

    record Episode(long timestamp, String sessionId, String stepKey, String query, double quality, String excerpt) {
    }
}
