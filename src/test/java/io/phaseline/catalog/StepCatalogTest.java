package io.phaseline.catalog;

import io.phaseline.config.PhaselineConfig;
import io.phaseline.model.PhaseDefinition;
import io.phaseline.model.StepDefinition;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

final class StepCatalogTest {

    @Test
    void bundledCatalogHasExpectedShape() {
        StepCatalog catalog = StepCatalog.bundled();
        Assertions.assertEquals(46, catalog.size());
        Assertions.assertEquals(6, catalog.dynamicPhase());
        Assertions.assertEquals(30, catalog.dynamicPhaseStart());
        Assertions.assertEquals(37, catalog.staticPostStartOffset());
        Assertions.assertEquals(9, catalog.staticAfterCount());
        Assertions.assertEquals("self-ask-decomposer", catalog.step(0).key());
        Assertions.assertEquals("dissertation-architect", catalog.step(29).key());
        Assertions.assertEquals(5, catalog.step(29).phase());
        Assertions.assertEquals(6, catalog.step(30).phase());
        Assertions.assertEquals(7, catalog.step(37).phase());
        Assertions.assertTrue(catalog.phase(6).orElseThrow().dynamic());

        Set<String> keys = new HashSet<>();
        int sum = 0;
        for (PhaseDefinition phase : catalog.phases()) {
            sum += phase.size();
        }
        for (StepDefinition step : catalog.steps()) {
            Assertions.assertTrue(keys.add(step.key()), "duplicate key " + step.key());
        }
        Assertions.assertEquals(catalog.size(), sum);
        Assertions.assertEquals("Phase 42", catalog.phaseName(42));
    }

    @Test
    void rejectsDuplicateKeys() {
        List<StepDefinition> steps = List.of(step("a", 1), step("a", 1));
        List<PhaseDefinition> phases = List.of(new PhaseDefinition(1, "One", List.of("a", "a"), "", true));
        IllegalStateException ex = Assertions.assertThrows(IllegalStateException.class,
                () -> StepCatalog.of(phases, steps, 1));
        Assertions.assertTrue(ex.getMessage().contains("Duplicate"));
    }

    @Test
    void rejectsPhaseSizesThatDoNotSumToStepCount() {
        List<StepDefinition> steps = List.of(step("a", 1), step("b", 1), step("c", 2));
        List<PhaseDefinition> phases = List.of(
                new PhaseDefinition(1, "One", List.of("a", "b"), "", false),
                new PhaseDefinition(2, "Two", List.of(), "", true)
        );
        Assertions.assertThrows(IllegalStateException.class, () -> StepCatalog.of(phases, steps, 2));
    }

    @Test
    void rejectsMissingDynamicPhaseAndPhaseMismatch() {
        List<StepDefinition> steps = List.of(step("a", 1), step("b", 2));
        List<PhaseDefinition> phases = List.of(
                new PhaseDefinition(1, "One", List.of("a"), "", false),
                new PhaseDefinition(2, "Two", List.of("b"), "", false)
        );
        Assertions.assertThrows(IllegalStateException.class, () -> StepCatalog.of(phases, steps, 9));

        List<PhaseDefinition> swapped = List.of(
                new PhaseDefinition(1, "One", List.of("b"), "", false),
                new PhaseDefinition(2, "Two", List.of("a"), "", true)
        );
        Assertions.assertThrows(IllegalStateException.class, () -> StepCatalog.of(swapped, steps, 2));
    }

    @Test
    void computesBoundariesForSmallCatalog() {
        StepCatalog catalog = StepCatalog.of(
                List.of(
                        new PhaseDefinition(1, "Before", List.of("a", "b"), "", false),
                        new PhaseDefinition(2, "Dynamic", List.of("c"), "", true),
                        new PhaseDefinition(3, "After", List.of("d", "e"), "", false)
                ),
                List.of(step("a", 1), step("b", 1), step("c", 2), step("d", 3), step("e", 3)),
                2
        );
        Assertions.assertEquals(2, catalog.dynamicPhaseStart());
        Assertions.assertEquals(3, catalog.staticPostStartOffset());
        Assertions.assertEquals(2, catalog.staticAfterCount());
        Assertions.assertEquals("d", catalog.find("d").orElseThrow().key());
        Assertions.assertTrue(catalog.find("zzz").isEmpty());
    }

    @Test
    void rootOverrideReplacesBundledCatalog() throws Exception {
        Path root = Files.createTempDirectory("phaseline-test-catalog-override-");
        try {
            PhaselineConfig config = PhaselineConfig.fromRoot(root);
            String json = "{\"dynamicPhase\":2,"
                    + "\"phases\":[{\"id\":1,\"name\":\"One\",\"stepKeys\":[\"a\"]},"
                    + "{\"id\":2,\"name\":\"Two\",\"stepKeys\":[\"b\"],\"dynamic\":true}],"
                    + "\"steps\":[{\"key\":\"a\",\"name\":\"A\",\"phase\":1,\"timeout\":60},"
                    + "{\"key\":\"b\",\"name\":\"B\",\"phase\":2,\"timeout\":60}]}";
            Files.writeString(config.catalogOverrideFile(), json, StandardCharsets.UTF_8);
            StepCatalog catalog = StepCatalog.load(config);
            Assertions.assertEquals(2, catalog.size());
            Assertions.assertEquals(1, catalog.dynamicPhaseStart());

            Assertions.assertThrows(IllegalStateException.class, () -> StepCatalog.read(
                    new ByteArrayInputStream("{\"phases\":[]}".getBytes(StandardCharsets.UTF_8)), "inline"));
        } finally {
            deleteRecursively(root);
        }
    }

    private static StepDefinition step(String key, int phase) {
        return new StepDefinition(key, key.toUpperCase(), phase, List.of(), 60, true, List.of(key + ".md"), "");
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
