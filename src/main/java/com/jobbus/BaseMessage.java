package com.jobbus;

/**
 * Base type of every payload carried by the bus.
 * <p>
 * {@code id} identifies one logical message and becomes the wire message id and partition key.
 * {@code runId} names the run that produced it; consumers configured for a different run drop it
 * without invoking their handler.
 */
public abstract class BaseMessage {

    private String id;
    private String runId;

    protected BaseMessage() {
    }

    protected BaseMessage(String id, String runId) {
        this.id = id;
        this.runId = runId;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getRunId() {
        return runId;
    }

    public void setRunId(String runId) {
        this.runId = runId;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id='" + id + "', runId='" + runId + "'}";
    }
}
