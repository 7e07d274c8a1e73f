package io.phaseline.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.phaseline.catalog.DynamicExpander;
import io.phaseline.catalog.StepCatalog;
import io.phaseline.checkpoint.CheckpointManager;
import io.phaseline.collaborator.EpisodicMemory;
import io.phaseline.collaborator.PromptBuilder;
import io.phaseline.collaborator.PromptContext;
import io.phaseline.collaborator.QualityScorer;
import io.phaseline.config.PhaselineConfig;
import io.phaseline.config.PhaselineSettings;
import io.phaseline.error.ErrorKind;
import io.phaseline.error.PipelineException;
import io.phaseline.error.SessionExpiredException;
import io.phaseline.error.StepMismatchException;
import io.phaseline.error.StructureNotLockedException;
import io.phaseline.error.StructureNotReadyException;
import io.phaseline.model.Checkpoint;
import io.phaseline.model.CoverageGrade;
import io.phaseline.model.DataSourceMode;
import io.phaseline.model.QueryIntent;
import io.phaseline.model.Session;
import io.phaseline.model.SessionError;
import io.phaseline.model.SessionStatus;
import io.phaseline.model.StepDefinition;
import io.phaseline.model.ToolPermissions;
import io.phaseline.model.ToolUsageEntry;
import io.phaseline.observability.AuditLogger;
import io.phaseline.policy.ToolGate;
import io.phaseline.storage.SessionStore;
import io.phaseline.util.Hashing;
import io.phaseline.util.Slugs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Session state machine. Resolves the current step, advances on completion, freezes the
 * dynamic phase once its structure is locked and refuses to touch expired sessions.
 *
 * <p>Not thread-safe on its own; the daemon serializes calls through the warm bundle lock.
 */
public final class Orchestrator {
    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);
    private static final long DAY_MS = 24L * 60L * 60L * 1000L;
    static final int STATUS_QUERY_CHARS = 200;
    static final int LIST_QUERY_CHARS = 50;

    private final PhaselineConfig config;
    private final PhaselineSettings settings;
    private final SessionStore store;
    private final StepRouter router;
    private final DynamicExpander expander;
    private final CheckpointManager checkpoints;
    private final PromptBuilder promptBuilder;
    private final QualityScorer qualityScorer;
    private final EpisodicMemory episodicMemory;
    private final AuditLogger auditLogger;

    public Orchestrator(
            PhaselineConfig config,
            PhaselineSettings settings,
            SessionStore store,
            StepCatalog catalog,
            DynamicExpander expander,
            CheckpointManager checkpoints,
            PromptBuilder promptBuilder,
            QualityScorer qualityScorer,
            EpisodicMemory episodicMemory,
            AuditLogger auditLogger
    ) {
        this.config = config;
        this.settings = settings;
        this.store = store;
        this.router = new StepRouter(catalog);
        this.expander = expander;
        this.checkpoints = checkpoints;
        this.promptBuilder = promptBuilder;
        this.qualityScorer = qualityScorer;
        this.episodicMemory = episodicMemory;
        this.auditLogger = auditLogger;
    }

    public InitOutcome init(String query, String mode) {
        if (query == null || query.isBlank()) {
            throw new PipelineException(ErrorKind.INVALID_REQUEST, "Query is required");
        }
        DataSourceMode dataSourceMode;
        try {
            dataSourceMode = DataSourceMode.parse(mode);
        } catch (IllegalArgumentException e) {
            throw new PipelineException(ErrorKind.INVALID_REQUEST, e.getMessage());
        }
        String trimmed = query.trim();
        String sessionId = UUID.randomUUID().toString();
        Session session = store.create(sessionId, trimmed, "pipeline-" + Hashing.shortHash(trimmed), dataSourceMode);
        String slug = Slugs.slugify(trimmed);
        session.setSlug(slug.isEmpty() ? "session-" + sessionId.substring(0, 8) : slug);
        QueryIntent intent = ToolGate.analyzeQueryIntent(trimmed);
        session.setQueryIntent(intent);
        session.setCoverageGrade(CoverageGrade.NONE);
        session.setToolPermissions(ToolGate.resolvePermissions(dataSourceMode, CoverageGrade.NONE, intent));
        session.setCurrentPhase(router.phaseAt(session, 0));
        store.save(session);
        StepPayload first = payload(session, 0);
        log.info("Initialized session {} ({} steps, mode {})", sessionId, router.effectiveTotal(session), dataSourceMode);
        audit("session.init", session, null, "ok", Map.of("mode", dataSourceMode.name(), "slug", session.getSlug()));
        return new InitOutcome(
                sessionId,
                session.getPipelineId(),
                trimmed,
                session.getSlug(),
                dataSourceMode,
                router.effectiveTotal(session),
                first,
                session.getToolPermissions()
        );
    }

    /**
     * Current step payload, or a completion summary once every step is done. May persist the
     * one-time dynamic expansion and always touches lastActivityTime.
     */
    public NextOutcome next(String sessionId) {
        return current(loadActive(sessionId), false);
    }

    public NextOutcome resume(String sessionId) {
        Session session = loadActive(sessionId);
        if (session.getStatus() == SessionStatus.PAUSED) {
            session.setStatus(SessionStatus.RUNNING);
        }
        return current(session, true);
    }

    public CompleteOutcome complete(String sessionId, String stepKey, JsonNode output) {
        if (stepKey == null || stepKey.isBlank()) {
            throw new PipelineException(ErrorKind.INVALID_REQUEST, "Step key is required");
        }
        Session session = loadActive(sessionId);
        if (session.getStatus() == SessionStatus.FAILED) {
            throw new PipelineException(ErrorKind.INVALID_STATE, "Session " + sessionId + " was aborted");
        }
        // Expansion stays in memory until the advance below is persisted, so a mismatch writes nothing.
        tryExpand(session);
        int total = router.effectiveTotal(session);
        int index = session.getCurrentAgentIndex();
        if (index >= total) {
            throw new PipelineException(ErrorKind.INVALID_STATE, "Pipeline already complete");
        }
        StepDefinition expected = router.stepAt(session, index)
                .orElseThrow(() -> new PipelineException(ErrorKind.INTERNAL, "No step resolves at index " + index));
        if (!expected.key().equals(stepKey.trim())) {
            throw new StepMismatchException(expected.key(), stepKey);
        }
        JsonNode captured = output != null ? output : captureOutput(session, index, expected);
        session.getCompletedAgents().add(expected.key());
        if (captured != null) {
            session.getAgentOutputs().put(expected.key(), captured);
        }
        int nextIndex = index + 1;
        boolean done = nextIndex >= total;
        session.setCurrentAgentIndex(nextIndex);
        session.setCurrentPhase(router.phaseAt(session, nextIndex));
        if (done) {
            session.setStatus(SessionStatus.COMPLETED);
        }
        session.setLastActivityTime(System.currentTimeMillis());
        store.save(session);

        double quality = qualityScorer.score(captured, expected);
        String checkpointId = checkpoint(session, expected, quality);
        remember(session, expected, captured, quality);
        audit("step.complete", session, expected.key(), "ok", Map.of("index", index, "quality", quality));
        String nextKey = done ? null : router.stepAt(session, nextIndex).map(StepDefinition::key).orElse(null);
        return new CompleteOutcome(
                true,
                sessionId,
                expected.key(),
                nextKey,
                done,
                nextIndex,
                total,
                quality,
                checkpointId
        );
    }

    public StatusOutcome status(String sessionId) {
        Session session = loadActive(sessionId);
        int index = session.getCurrentAgentIndex();
        Optional<StepDefinition> current = router.stepAt(session, index);
        long now = System.currentTimeMillis();
        return new StatusOutcome(
                session.getSessionId(),
                session.getPipelineId(),
                truncate(session.getQuery(), STATUS_QUERY_CHARS),
                session.getStatus(),
                session.getDataSourceMode(),
                session.getCurrentPhase(),
                router.catalog().phaseName(session.getCurrentPhase()),
                current.map(StepDefinition::key).orElse(null),
                current.map(StepDefinition::name).orElse(null),
                progress(session),
                session.getStartTime(),
                session.getLastActivityTime(),
                now - session.getStartTime(),
                session.expanded(),
                session.getErrors(),
                session.getToolPermissions()
        );
    }

    public ListOutcome list(boolean all) {
        int maxAgeDays = all ? settings.listAllMaxAgeDays() : settings.listMaxAgeDays();
        List<SessionSummary> out = new ArrayList<>();
        for (Session session : store.list(false, maxAgeDays)) {
            out.add(new SessionSummary(
                    session.getSessionId(),
                    truncate(session.getQuery(), LIST_QUERY_CHARS),
                    session.getStatus(),
                    session.getCurrentPhase(),
                    router.catalog().phaseName(session.getCurrentPhase()),
                    progress(session),
                    session.getLastActivityTime(),
                    store.isExpired(session)
            ));
        }
        return new ListOutcome(out.size(), maxAgeDays, out);
    }

    public AbortOutcome abort(String sessionId) {
        Session session = loadActive(sessionId);
        if (session.getStatus().terminal()) {
            return new AbortOutcome(sessionId, false, session.getStatus(), session.getCompletedAgents().size());
        }
        store.updateStatus(session, SessionStatus.FAILED);
        log.info("Aborted session {} after {} steps", sessionId, session.getCompletedAgents().size());
        audit("session.abort", session, null, "ok", Map.of());
        return new AbortOutcome(sessionId, true, SessionStatus.FAILED, session.getCompletedAgents().size());
    }

    public CheckpointsOutcome checkpoints(String sessionId) {
        loadActive(sessionId);
        List<Checkpoint> all = checkpoints.loadCheckpoints(sessionId);
        String latest = all.isEmpty() ? null : all.get(all.size() - 1).id();
        return new CheckpointsOutcome(sessionId, all.size(), latest, all);
    }

    /**
     * Restores the context snapshot of a checkpoint (latest when {@code checkpointId} is null)
     * and moves the session cursor back to that point. Generated steps stay frozen.
     */
    public RollbackOutcome rollback(String sessionId, String checkpointId) {
        Session session = loadActive(sessionId);
        Optional<Checkpoint> target = checkpointId == null || checkpointId.isBlank()
                ? checkpoints.getLatestCheckpoint(sessionId)
                : checkpoints.find(sessionId, checkpointId.trim());
        int index = session.getCurrentAgentIndex();
        if (target.isEmpty()) {
            return new RollbackOutcome(sessionId, checkpointId, false, "checkpoint not found", index, List.of());
        }
        Checkpoint checkpoint = target.get();
        List<String> kept = checkpoint.completedAgents();
        List<String> completed = session.getCompletedAgents();
        if (kept.size() > completed.size() || !completed.subList(0, kept.size()).equals(kept)) {
            throw new PipelineException(ErrorKind.INVALID_STATE,
                    "Checkpoint " + checkpoint.id() + " does not match the session's completed steps");
        }
        if (!checkpoints.rollbackToCheckpoint(sessionId, checkpoint.id())) {
            return new RollbackOutcome(sessionId, checkpoint.id(), false,
                    "checkpoint is corrupted or has no snapshot", index, List.of());
        }
        List<String> removed = new ArrayList<>(completed.subList(kept.size(), completed.size()));
        session.setCompletedAgents(kept);
        Map<String, JsonNode> outputs = new LinkedHashMap<>(session.getAgentOutputs());
        Set<String> keep = new HashSet<>(kept);
        outputs.keySet().removeIf(key -> !keep.contains(key));
        session.setAgentOutputs(outputs);
        session.setCurrentAgentIndex(kept.size());
        session.setCurrentPhase(router.phaseAt(session, kept.size()));
        session.setStatus(SessionStatus.RUNNING);
        store.updateActivity(session);
        log.info("Rolled back session {} to checkpoint {} ({} steps undone)", sessionId, checkpoint.id(), removed.size());
        audit("session.rollback", session, checkpoint.stepKey(), "ok",
                Map.of("checkpoint", checkpoint.id(), "removed", removed));
        return new RollbackOutcome(sessionId, checkpoint.id(), true, null, kept.size(), removed);
    }

    /**
     * Deletes expired sessions whose last activity is older than {@code olderThanDays}.
     */
    public PurgeOutcome purge(int olderThanDays) {
        long cutoff = System.currentTimeMillis() - Math.max(0, olderThanDays) * DAY_MS;
        List<Session> all = store.list(true, 0);
        List<String> deleted = new ArrayList<>();
        for (Session session : all) {
            if (store.isExpired(session) && session.getLastActivityTime() <= cutoff) {
                store.delete(session.getSessionId());
                deleted.add(session.getSessionId());
            }
        }
        if (!deleted.isEmpty()) {
            log.info("Purged {} expired sessions", deleted.size());
        }
        return new PurgeOutcome(all.size(), deleted);
    }

    public ToolUsageOutcome recordToolUsage(String sessionId, String stepKey, String tool, String justification) {
        if (tool == null || tool.isBlank()) {
            throw new PipelineException(ErrorKind.INVALID_REQUEST, "Tool name is required");
        }
        Session session = loadActive(sessionId);
        ToolPermissions permissions = permissionsOf(session);
        ToolUsageEntry entry = new ToolUsageEntry(
                System.currentTimeMillis(),
                stepKey,
                tool.trim(),
                justification == null ? "" : justification,
                session.getCoverageGrade(),
                permissions.allows(tool)
        );
        List<ToolUsageEntry> usage = session.getToolUsageLog() == null
                ? new ArrayList<>()
                : new ArrayList<>(session.getToolUsageLog());
        usage.add(entry);
        session.setToolUsageLog(usage);
        store.updateActivity(session);
        audit("tool.usage", session, stepKey, entry.allowed() ? "allowed" : "denied", Map.of("tool", entry.tool()));
        return new ToolUsageOutcome(sessionId, entry.allowed(), entry, permissions);
    }

    public CoverageOutcome updateCoverage(String sessionId, CoverageGrade grade) {
        Session session = loadActive(sessionId);
        session.setCoverageGrade(grade);
        ToolPermissions permissions = ToolGate.resolvePermissions(
                session.getDataSourceMode(), grade, session.getQueryIntent());
        session.setToolPermissions(permissions);
        store.updateActivity(session);
        return new CoverageOutcome(sessionId, grade, permissions);
    }

    public StepRouter router() {
        return router;
    }

    private Session loadActive(String sessionId) {
        Session session = store.load(sessionId);
        if (store.isExpired(session)) {
            throw new SessionExpiredException(sessionId, session.getLastActivityTime());
        }
        return session;
    }

    private NextOutcome current(Session session, boolean resumed) {
        boolean expanded = tryExpand(session);
        int index = session.getCurrentAgentIndex();
        int total = router.effectiveTotal(session);
        if (index >= total) {
            if (expanded) {
                store.save(session);
            }
            long duration = System.currentTimeMillis() - session.getStartTime();
            CompletionSummary summary = new CompletionSummary(
                    duration, session.getCompletedAgents().size(), session.getErrors().size());
            return new NextOutcome(session.getSessionId(), "complete", resumed, null, progress(session), summary);
        }
        StepPayload payload = payload(session, index);
        session.setCurrentPhase(payload.phase());
        store.updateActivity(session);
        return new NextOutcome(session.getSessionId(), "running", resumed, payload, progress(session), null);
    }

    private boolean tryExpand(Session session) {
        if (!router.expansionPending(session)) {
            return false;
        }
        List<StepDefinition> generated;
        try {
            generated = expander.expand(session.getSlug());
        } catch (StructureNotReadyException | StructureNotLockedException e) {
            log.debug("Dynamic phase not expanded yet for {}: {}", session.getSessionId(), e.getMessage());
            return false;
        }
        session.setDynamicAgents(generated);
        session.setDynamicTotalAgents(router.frozenTotal(generated.size()));
        session.setCurrentPhase(router.phaseAt(session, session.getCurrentAgentIndex()));
        log.info("Session {} expanded to {} steps ({} generated)",
                session.getSessionId(), session.getDynamicTotalAgents(), generated.size());
        audit("session.expand", session, null, "ok", Map.of("generated", generated.size(),
                "total", session.getDynamicTotalAgents()));
        return true;
    }

    private StepPayload payload(Session session, int index) {
        int total = router.effectiveTotal(session);
        StepDefinition step = router.stepAt(session, index)
                .orElseThrow(() -> new PipelineException(ErrorKind.INTERNAL, "No step resolves at index " + index));
        String previous = index > 0 ? router.stepAt(session, index - 1).map(StepDefinition::key).orElse(null) : null;
        String next = index + 1 < total ? router.stepAt(session, index + 1).map(StepDefinition::key).orElse(null) : null;
        String phaseName = router.catalog().phaseName(step.phase());
        PromptContext context = new PromptContext(
                session.getSessionId(),
                session.getQuery(),
                session.getSlug(),
                index + 1,
                total,
                step.phase(),
                phaseName,
                previous,
                next,
                config.researchDir(session.getSlug()).toString()
        );
        String prompt = promptBuilder.build(step, context);
        int episodesUsed = 0;
        try {
            EpisodicMemory.InjectionResult injected = episodicMemory.inject(prompt,
                    new EpisodicMemory.InjectionOptions(session.getSessionId(), step.key(), settings.episodicWindow()));
            prompt = injected.augmentedPrompt();
            episodesUsed = injected.used();
        } catch (RuntimeException e) {
            log.warn("Episodic injection skipped for {}: {}", step.key(), e.toString());
        }
        return new StepPayload(
                index,
                step.key(),
                step.name(),
                step.phase(),
                phaseName,
                step.dependencies(),
                step.timeout(),
                step.critical(),
                step.expectedOutputs(),
                router.resolveStep(session, index).map(ref -> ref.isGenerated()).orElse(false),
                prompt,
                episodesUsed
        );
    }

    private Progress progress(Session session) {
        int completed = session.getCompletedAgents().size();
        int total = router.effectiveTotal(session);
        double percentage = total == 0 ? 0.0d : Math.round(completed * 1000.0d / total) / 10.0d;
        return new Progress(completed, total, percentage, session.getCurrentPhase(),
                router.catalog().phaseName(session.getCurrentPhase()));
    }

    private JsonNode captureOutput(Session session, int index, StepDefinition step) {
        Path dir = config.researchDir(session.getSlug());
        List<Path> candidates = new ArrayList<>();
        candidates.add(dir.resolve(String.format("%02d-%s.md", index + 1, step.key())));
        for (String expected : step.expectedOutputs()) {
            candidates.add(dir.resolve(expected));
        }
        candidates.add(dir.resolve(step.key() + ".md"));
        for (Path candidate : candidates) {
            if (!Files.isRegularFile(candidate)) {
                continue;
            }
            try {
                return TextNode.valueOf(Files.readString(candidate, StandardCharsets.UTF_8));
            } catch (IOException e) {
                log.warn("Could not read step output {}: {}", candidate, e.toString());
            }
        }
        return null;
    }

    private String checkpoint(Session session, StepDefinition step, double quality) {
        try {
            return checkpoints.createCheckpoint(session.getSessionId(), step.phase(), step.key(), quality);
        } catch (RuntimeException e) {
            log.warn("Checkpoint failed for session {} at {}: {}", session.getSessionId(), step.key(), e.toString());
            session.getErrors().add(new SessionError(step.key(), "checkpoint failed: " + e.getMessage(),
                    System.currentTimeMillis()));
            try {
                store.save(session);
            } catch (PipelineException persist) {
                log.warn("Could not record checkpoint failure for {}: {}", session.getSessionId(), persist.getMessage());
            }
            return null;
        }
    }

    private void remember(Session session, StepDefinition step, JsonNode output, double quality) {
        if (output == null) {
            return;
        }
        try {
            String text = output.isTextual() ? output.asText() : output.toString();
            episodicMemory.store(new EpisodicMemory.Episode(System.currentTimeMillis(), session.getSessionId(),
                    step.key(), session.getQuery(), quality, text));
        } catch (RuntimeException e) {
            log.warn("Episode not stored for {}: {}", step.key(), e.toString());
        }
    }

    private void audit(String action, Session session, String stepKey, String result, Map<String, Object> details) {
        if (auditLogger == null) {
            return;
        }
        try {
            auditLogger.log(AuditLogger.AuditEvent.of(action, "session/" + session.getSessionId(), result,
                    session.getSessionId(), stepKey, details));
        } catch (RuntimeException e) {
            log.warn("Audit write failed for {}: {}", action, e.toString());
        }
    }

    private ToolPermissions permissionsOf(Session session) {
        if (session.getToolPermissions() != null) {
            return session.getToolPermissions();
        }
        return ToolGate.resolvePermissions(session.getDataSourceMode(), session.getCoverageGrade(), session.getQueryIntent());
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max) + "...";
    }

    public record StepPayload(
            int index,
            String key,
            String name,
            int phase,
            String phaseName,
            List<String> dependencies,
            int timeout,
            boolean critical,
            List<String> expectedOutputs,
            boolean generated,
            String prompt,
            int episodesUsed
    ) {
    }

    public record Progress(int completed, int total, double percentage, int currentPhase, String phaseName) {
    }

    public record CompletionSummary(long durationMs, int agentsCompleted, int errors) {
    }

    public record InitOutcome(
            String sessionId,
            String pipelineId,
            String query,
            String slug,
            DataSourceMode dataSourceMode,
            int totalAgents,
            StepPayload agent,
            ToolPermissions toolPermissions
    ) {
    }

    public record NextOutcome(
            String sessionId,
            String status,
            boolean resumed,
            StepPayload agent,
            Progress progress,
            CompletionSummary summary
    ) {
        public boolean complete() {
            return agent == null;
        }
    }

    public record CompleteOutcome(
            boolean success,
            String sessionId,
            String completedAgent,
            String nextAgent,
            boolean pipelineComplete,
            int currentAgentIndex,
            int totalAgents,
            double quality,
            String checkpointId
    ) {
    }

    public record StatusOutcome(
            String sessionId,
            String pipelineId,
            String query,
            SessionStatus status,
            DataSourceMode dataSourceMode,
            int currentPhase,
            String phaseName,
            String currentAgent,
            String currentAgentName,
            Progress progress,
            long startTime,
            long lastActivityTime,
            long elapsedTime,
            boolean dynamicExpanded,
            List<SessionError> errors,
            ToolPermissions toolPermissions
    ) {
    }

    public record SessionSummary(
            String sessionId,
            String query,
            SessionStatus status,
            int currentPhase,
            String phaseName,
            Progress progress,
            long lastActivityTime,
            boolean expired
    ) {
    }

    public record ListOutcome(int total, int maxAgeDays, List<SessionSummary> sessions) {
    }

    public record AbortOutcome(String sessionId, boolean aborted, SessionStatus finalStatus, int completedAgents) {
    }

    public record CheckpointsOutcome(String sessionId, int total, String latestId, List<Checkpoint> checkpoints) {
    }

    public record RollbackOutcome(
            String sessionId,
            String checkpointId,
            boolean rolledBack,
            String reason,
            int currentAgentIndex,
            List<String> removedAgents
    ) {
    }

    public record PurgeOutcome(int scanned, List<String> deleted) {
    }

    public record ToolUsageOutcome(String sessionId, boolean allowed, ToolUsageEntry entry, ToolPermissions permissions) {
    }

    public record CoverageOutcome(String sessionId, CoverageGrade coverageGrade, ToolPermissions permissions) {
    }
}
