package io.phaseline.collaborator;

/**
 * What a prompt builder may know about the surrounding pipeline. {@code position} is 1-based.
 */
public record PromptContext(
        String sessionId,
        String query,
        String slug,
        int position,
        int total,
        int phase,
        String phaseName,
        String previousKey,
        String nextKey,
        String outputDir
) {
}
