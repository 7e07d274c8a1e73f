package io.phaseline.daemon;

import io.phaseline.catalog.DynamicExpander;
import io.phaseline.catalog.FileLockedStructureLoader;
import io.phaseline.catalog.StepCatalog;
import io.phaseline.checkpoint.CheckpointManager;
import io.phaseline.collaborator.FileEpisodicMemory;
import io.phaseline.collaborator.HeuristicQualityScorer;
import io.phaseline.collaborator.WorkflowPromptBuilder;
import io.phaseline.config.PhaselineConfig;
import io.phaseline.config.PhaselineSettings;
import io.phaseline.observability.AuditLogger;
import io.phaseline.runtime.Orchestrator;
import io.phaseline.storage.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * The expensively built dependencies kept alive between daemon requests. All stateful access
 * goes through {@link #withLock(Supplier)}.
 */
public final class WarmBundle implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WarmBundle.class);

    private final PhaselineConfig config;
    private final PhaselineSettings settings;
    private final int generation;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile StepCatalog catalog;
    private volatile Orchestrator orchestrator;
    private volatile boolean closed;

    public WarmBundle(PhaselineConfig config, PhaselineSettings settings, int generation) {
        this.config = config;
        this.settings = settings;
        this.generation = generation;
    }

    public WarmBundle initialize() {
        long started = System.nanoTime();
        lock.lock();
        try {
            StepCatalog loaded = StepCatalog.load(config);
            SessionStore store = new SessionStore(config, settings);
            CheckpointManager checkpoints = new CheckpointManager(config, store);
            DynamicExpander expander = new DynamicExpander(loaded, new FileLockedStructureLoader(config));
            this.orchestrator = new Orchestrator(
                    config,
                    settings,
                    store,
                    loaded,
                    expander,
                    checkpoints,
                    new WorkflowPromptBuilder(),
                    new HeuristicQualityScorer(),
                    new FileEpisodicMemory(config.episodesFile()),
                    openAudit()
            );
            this.catalog = loaded;
        } finally {
            lock.unlock();
        }
        log.info("Warm bundle #{} ready in {} ms ({} catalog steps)",
                generation, (System.nanoTime() - started) / 1_000_000L, catalog.size());
        return this;
    }

    public <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            if (closed) {
                // In-flight requests that captured this bundle before a restart still finish here.
                log.debug("Serving request on retired bundle #{}", generation);
            }
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public Orchestrator orchestrator() {
        Orchestrator current = orchestrator;
        if (current == null) {
            throw new IllegalStateException("Warm bundle #" + generation + " is not initialized");
        }
        return current;
    }

    public StepCatalog catalog() {
        return catalog;
    }

    public int generation() {
        return generation;
    }

    public boolean initialized() {
        return orchestrator != null;
    }

    @Override
    public void close() {
        closed = true;
        log.info("Warm bundle #{} retired", generation);
    }

    private AuditLogger openAudit() {
        try {
            return new AuditLogger(config.auditLogFile());
        } catch (RuntimeException e) {
            log.warn("Audit log disabled: {}", e.toString());
            return null;
        }
    }
}
