package io.phaseline.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Persistent progress record of one pipeline run.
 *
 * <p>{@code completedAgents} is append-only outside of an explicit rollback and always has
 * {@code currentAgentIndex} entries. Once {@code dynamicTotalAgents} is set it is frozen for
 * the life of the session.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Session {
    public static final List<String> REQUIRED_FIELDS = List.of(
            "sessionId",
            "pipelineId",
            "query",
            "dataSourceMode",
            "status",
            "currentPhase",
            "currentAgentIndex",
            "completedAgents",
            "agentOutputs",
            "startTime",
            "lastActivityTime",
            "errors"
    );

    private String sessionId;
    private String pipelineId;
    private String query;
    private String slug;
    private DataSourceMode dataSourceMode;
    private SessionStatus status;
    private int currentPhase;
    private int currentAgentIndex;
    private List<String> completedAgents = new ArrayList<>();
    private Map<String, JsonNode> agentOutputs = new LinkedHashMap<>();
    private long startTime;
    private long lastActivityTime;
    private List<SessionError> errors = new ArrayList<>();
    private List<StepDefinition> dynamicAgents;
    private Integer dynamicTotalAgents;
    private ToolPermissions toolPermissions;
    private QueryIntent queryIntent;
    private CoverageGrade coverageGrade;
    private List<ToolUsageEntry> toolUsageLog;

    public String getSessionId() {
        return sessionId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    public String getPipelineId() {
        return pipelineId;
    }

    public void setPipelineId(String pipelineId) {
        this.pipelineId = pipelineId;
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public String getSlug() {
        return slug;
    }

    public void setSlug(String slug) {
        this.slug = slug;
    }

    public DataSourceMode getDataSourceMode() {
        return dataSourceMode;
    }

    public void setDataSourceMode(DataSourceMode dataSourceMode) {
        this.dataSourceMode = dataSourceMode;
    }

    public SessionStatus getStatus() {
        return status;
    }

    public void setStatus(SessionStatus status) {
        this.status = status;
    }

    public int getCurrentPhase() {
        return currentPhase;
    }

    public void setCurrentPhase(int currentPhase) {
        this.currentPhase = currentPhase;
    }

    public int getCurrentAgentIndex() {
        return currentAgentIndex;
    }

    public void setCurrentAgentIndex(int currentAgentIndex) {
        this.currentAgentIndex = currentAgentIndex;
    }

    public List<String> getCompletedAgents() {
        return completedAgents;
    }

    public void setCompletedAgents(List<String> completedAgents) {
        this.completedAgents = completedAgents == null ? new ArrayList<>() : new ArrayList<>(completedAgents);
    }

    public Map<String, JsonNode> getAgentOutputs() {
        return agentOutputs;
    }

    public void setAgentOutputs(Map<String, JsonNode> agentOutputs) {
        this.agentOutputs = agentOutputs == null ? new LinkedHashMap<>() : new LinkedHashMap<>(agentOutputs);
    }

    public long getStartTime() {
        return startTime;
    }

    public void setStartTime(long startTime) {
        this.startTime = startTime;
    }

    public long getLastActivityTime() {
        return lastActivityTime;
    }

    public void setLastActivityTime(long lastActivityTime) {
        this.lastActivityTime = lastActivityTime;
    }

    public List<SessionError> getErrors() {
        return errors;
    }

    public void setErrors(List<SessionError> errors) {
        this.errors = errors == null ? new ArrayList<>() : new ArrayList<>(errors);
    }

    public List<StepDefinition> getDynamicAgents() {
        return dynamicAgents;
    }

    public void setDynamicAgents(List<StepDefinition> dynamicAgents) {
        this.dynamicAgents = dynamicAgents == null ? null : List.copyOf(dynamicAgents);
    }

    public Integer getDynamicTotalAgents() {
        return dynamicTotalAgents;
    }

    public void setDynamicTotalAgents(Integer dynamicTotalAgents) {
        this.dynamicTotalAgents = dynamicTotalAgents;
    }

    public ToolPermissions getToolPermissions() {
        return toolPermissions;
    }

    public void setToolPermissions(ToolPermissions toolPermissions) {
        this.toolPermissions = toolPermissions;
    }

    public QueryIntent getQueryIntent() {
        return queryIntent;
    }

    public void setQueryIntent(QueryIntent queryIntent) {
        this.queryIntent = queryIntent;
    }

    public CoverageGrade getCoverageGrade() {
        return coverageGrade;
    }

    public void setCoverageGrade(CoverageGrade coverageGrade) {
        this.coverageGrade = coverageGrade;
    }

    public List<ToolUsageEntry> getToolUsageLog() {
        return toolUsageLog;
    }

    public void setToolUsageLog(List<ToolUsageEntry> toolUsageLog) {
        this.toolUsageLog = toolUsageLog == null ? null : new ArrayList<>(toolUsageLog);
    }

    public boolean expanded() {
        return dynamicAgents != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Session)) {
            return false;
        }
        Session other = (Session) o;
        return currentPhase == other.currentPhase
                && currentAgentIndex == other.currentAgentIndex
                && startTime == other.startTime
                && lastActivityTime == other.lastActivityTime
                && Objects.equals(sessionId, other.sessionId)
                && Objects.equals(pipelineId, other.pipelineId)
                && Objects.equals(query, other.query)
                && Objects.equals(slug, other.slug)
                && dataSourceMode == other.dataSourceMode
                && status == other.status
                && Objects.equals(completedAgents, other.completedAgents)
                && Objects.equals(agentOutputs, other.agentOutputs)
                && Objects.equals(errors, other.errors)
                && Objects.equals(dynamicAgents, other.dynamicAgents)
                && Objects.equals(dynamicTotalAgents, other.dynamicTotalAgents)
                && Objects.equals(toolPermissions, other.toolPermissions)
                && Objects.equals(queryIntent, other.queryIntent)
                && coverageGrade == other.coverageGrade
                && Objects.equals(toolUsageLog, other.toolUsageLog);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sessionId, pipelineId, query, status, currentAgentIndex, lastActivityTime);
    }

    @Override
    public String toString() {
        return "Session{" + sessionId + ", status=" + status + ", index=" + currentAgentIndex
                + ", phase=" + currentPhase + "}";
    }
}
