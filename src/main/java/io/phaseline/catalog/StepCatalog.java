package io.phaseline.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.phaseline.config.PhaselineConfig;
import io.phaseline.model.PhaseDefinition;
import io.phaseline.model.StepDefinition;
import io.phaseline.util.Jsons;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, validated step list grouped into phases. Exactly one phase is dynamic: its static
 * steps are placeholders that a session replaces with generated steps once a locked structure
 * exists.
 *
 * <p>Any inconsistency is a startup failure ({@link IllegalStateException}), never a runtime
 * error surfaced to a caller.
 */
public final class StepCatalog {
    public static final String DEFAULT_RESOURCE = "/pipeline/catalog.json";

    private final List<PhaseDefinition> phases;
    private final List<StepDefinition> steps;
    private final Map<String, Integer> indexByKey;
    private final int dynamicPhase;
    private final int dynamicPhaseStart;
    private final int staticPostStartOffset;

    private StepCatalog(List<PhaseDefinition> phases, List<StepDefinition> steps, int dynamicPhase) {
        this.phases = List.copyOf(phases);
        this.steps = List.copyOf(steps);
        this.dynamicPhase = dynamicPhase;
        this.indexByKey = validate(this.phases, this.steps, dynamicPhase);
        int start = 0;
        int dynamicSize = 0;
        for (PhaseDefinition phase : this.phases) {
            if (phase.id() == dynamicPhase) {
                dynamicSize = phase.size();
                break;
            }
            start += phase.size();
        }
        this.dynamicPhaseStart = start;
        this.staticPostStartOffset = start + dynamicSize;
    }

    public static StepCatalog of(List<PhaseDefinition> phases, List<StepDefinition> steps, int dynamicPhase) {
        return new StepCatalog(phases, steps, dynamicPhase);
    }

    /**
     * Loads {@code <root>/catalog.json} when present, otherwise the bundled catalog.
     */
    public static StepCatalog load(PhaselineConfig config) {
        Path override = config.catalogOverrideFile();
        if (Files.isRegularFile(override)) {
            try (InputStream in = Files.newInputStream(override)) {
                return read(in, override.toString());
            } catch (IOException e) {
                throw new IllegalStateException("Failed to read catalog: " + override, e);
            }
        }
        return bundled();
    }

    public static StepCatalog bundled() {
        try (InputStream in = StepCatalog.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing catalog resource " + DEFAULT_RESOURCE);
            }
            return read(in, DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read catalog resource " + DEFAULT_RESOURCE, e);
        }
    }

    static StepCatalog read(InputStream in, String source) throws IOException {
        CatalogFile file = Jsons.mapper().readValue(in, CatalogFile.class);
        if (file == null || file.phases() == null || file.steps() == null || file.dynamicPhase() == null) {
            throw new IllegalStateException("Catalog " + source + " must define phases, steps and dynamicPhase");
        }
        return new StepCatalog(file.phases(), file.steps(), file.dynamicPhase());
    }

    private static Map<String, Integer> validate(List<PhaseDefinition> phases, List<StepDefinition> steps, int dynamicPhase) {
        if (phases.isEmpty() || steps.isEmpty()) {
            throw new IllegalStateException("Catalog has no phases or no steps");
        }
        Map<String, Integer> index = new LinkedHashMap<>();
        for (int i = 0; i < steps.size(); i++) {
            StepDefinition step = steps.get(i);
            if (step.key() == null || step.key().isBlank()) {
                throw new IllegalStateException("Catalog step " + i + " has no key");
            }
            if (index.put(step.key(), i) != null) {
                throw new IllegalStateException("Duplicate catalog step key: " + step.key());
            }
        }
        int sum = 0;
        boolean dynamicFound = false;
        List<String> flattened = new ArrayList<>();
        for (PhaseDefinition phase : phases) {
            if (phase.id() == dynamicPhase) {
                dynamicFound = true;
            }
            for (String key : phase.stepKeys()) {
                Integer at = index.get(key);
                if (at == null) {
                    throw new IllegalStateException("Phase " + phase.id() + " references unknown step: " + key);
                }
                if (steps.get(at).phase() != phase.id()) {
                    throw new IllegalStateException("Step " + key + " declares phase " + steps.get(at).phase()
                            + " but is listed in phase " + phase.id());
                }
                flattened.add(key);
            }
            sum += phase.size();
        }
        if (sum != steps.size()) {
            throw new IllegalStateException("Catalog has " + steps.size() + " steps but phases list " + sum);
        }
        if (!dynamicFound) {
            throw new IllegalStateException("Dynamic phase " + dynamicPhase + " is not defined");
        }
        for (int i = 0; i < steps.size(); i++) {
            if (!steps.get(i).key().equals(flattened.get(i))) {
                throw new IllegalStateException("Catalog step order differs from phase order at index " + i);
            }
        }
        return Collections.unmodifiableMap(index);
    }

    public int size() {
        return steps.size();
    }

    public StepDefinition step(int index) {
        return steps.get(index);
    }

    public Optional<StepDefinition> find(String key) {
        Integer at = indexByKey.get(key);
        return at == null ? Optional.empty() : Optional.of(steps.get(at));
    }

    public Optional<PhaseDefinition> phase(int id) {
        for (PhaseDefinition phase : phases) {
            if (phase.id() == id) {
                return Optional.of(phase);
            }
        }
        return Optional.empty();
    }

    public String phaseName(int id) {
        return phase(id).map(PhaseDefinition::name).orElse("Phase " + id);
    }

    public List<PhaseDefinition> phases() {
        return phases;
    }

    public List<StepDefinition> steps() {
        return steps;
    }

    public int dynamicPhase() {
        return dynamicPhase;
    }

    /**
     * Effective index of the first dynamic-phase step.
     */
    public int dynamicPhaseStart() {
        return dynamicPhaseStart;
    }

    /**
     * Catalog index of the first step after the dynamic phase.
     */
    public int staticPostStartOffset() {
        return staticPostStartOffset;
    }

    public int staticAfterCount() {
        return steps.size() - staticPostStartOffset;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CatalogFile(Integer dynamicPhase, List<PhaseDefinition> phases, List<StepDefinition> steps) {
    }
}
