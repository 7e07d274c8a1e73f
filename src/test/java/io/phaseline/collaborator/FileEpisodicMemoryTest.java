package io.phaseline.collaborator;

import com.fasterxml.jackson.databind.node.TextNode;
import io.phaseline.model.StepDefinition;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class FileEpisodicMemoryTest {

    @Test
    void injectsRecentEpisodesOfTheSameStepFromOtherSessions() throws Exception {
        Path root = Files.createTempDirectory("phaseline-test-episodes-");
        try {
            FileEpisodicMemory memory = new FileEpisodicMemory(root.resolve("context").resolve("episodes.jsonl"));
            Assertions.assertEquals(0, memory.inject("prompt", new EpisodicMemory.InjectionOptions("s1", "k", 3)).used());

            memory.store(new EpisodicMemory.Episode(1L, "s0", "k", "old query", 0.4d, "first"));
            memory.store(new EpisodicMemory.Episode(2L, "s2", "k", "q2", 0.5d, "second"));
            memory.store(new EpisodicMemory.Episode(3L, "s3", "k", "q3", 0.6d, "x".repeat(1_000)));
            memory.store(new EpisodicMemory.Episode(4L, "s1", "k", "own", 0.9d, "mine"));
            memory.store(new EpisodicMemory.Episode(5L, "s4", "other", "q4", 0.9d, "unrelated"));

            EpisodicMemory.InjectionResult result = memory.inject("prompt",
                    new EpisodicMemory.InjectionOptions("s1", "k", 2));
            Assertions.assertEquals(2, result.used());
            Assertions.assertTrue(result.augmentedPrompt().startsWith("prompt"));
            Assertions.assertTrue(result.augmentedPrompt().contains("## RELATED PAST EPISODES"));
            Assertions.assertTrue(result.augmentedPrompt().contains("second"));
            Assertions.assertFalse(result.augmentedPrompt().contains("first"));
            Assertions.assertFalse(result.augmentedPrompt().contains("mine"));
            Assertions.assertFalse(result.augmentedPrompt().contains("x".repeat(FileEpisodicMemory.EXCERPT_CHARS + 1)));

            Assertions.assertEquals("prompt",
                    memory.inject("prompt", new EpisodicMemory.InjectionOptions("s1", "k", 0)).augmentedPrompt());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void heuristicScoreRewardsLengthAndStructure() {
        HeuristicQualityScorer scorer = new HeuristicQualityScorer();
        StepDefinition step = new StepDefinition("k", "K", 1, List.of(), 60, true, List.of(), "");
        Assertions.assertEquals(0.0d, scorer.score(null, step));
        Assertions.assertEquals(0.0d, scorer.score(TextNode.valueOf("   "), step));

        double plain = scorer.score(TextNode.valueOf("a few words only"), step);
        double structured = scorer.score(TextNode.valueOf("# Title\n- a few words only"), step);
        Assertions.assertTrue(plain > 0.0d);
        Assertions.assertTrue(structured > plain);

        String longText = "# Heading\n- item\n" + "word ".repeat(800);
        Assertions.assertEquals(1.0d, scorer.score(TextNode.valueOf(longText), step), 1e-9);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
