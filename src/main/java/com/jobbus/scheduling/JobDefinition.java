package com.jobbus.scheduling;

import com.jobbus.BaseMessage;

import java.time.Instant;

/**
 * A job rule and its schedule, together with the upper bound of the last window that ran.
 */
public class JobDefinition extends BaseMessage {

    private String ruleId;
    private String name;
    private Schedule schedule;
    private Instant lastRunWindowUpperBound;
    private String etag;
    private Instant jobDefinitionChangeTime;
    private String status;
    private String behaviorMode;

    public JobDefinition() {
    }

    public JobDefinition(String id, String runId, String ruleId, Schedule schedule) {
        super(id, runId);
        this.ruleId = ruleId;
        this.schedule = schedule;
    }

    public String getRuleId() {
        return ruleId;
    }

    public void setRuleId(String ruleId) {
        this.ruleId = ruleId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Schedule getSchedule() {
        return schedule;
    }

    public void setSchedule(Schedule schedule) {
        this.schedule = schedule;
    }

    public Instant getLastRunWindowUpperBound() {
        return lastRunWindowUpperBound;
    }

    public void setLastRunWindowUpperBound(Instant lastRunWindowUpperBound) {
        this.lastRunWindowUpperBound = lastRunWindowUpperBound;
    }

    public String getEtag() {
        return etag;
    }

    public void setEtag(String etag) {
        this.etag = etag;
    }

    public Instant getJobDefinitionChangeTime() {
        return jobDefinitionChangeTime;
    }

    public void setJobDefinitionChangeTime(Instant jobDefinitionChangeTime) {
        this.jobDefinitionChangeTime = jobDefinitionChangeTime;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getBehaviorMode() {
        return behaviorMode;
    }

    public void setBehaviorMode(String behaviorMode) {
        this.behaviorMode = behaviorMode;
    }
}
