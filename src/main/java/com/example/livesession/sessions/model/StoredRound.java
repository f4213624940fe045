package com.example.livesession.sessions.model;

import com.example.livesession.model.CloseReason;

import java.time.Instant;

/** Round row of a stored session snapshot; responses are stored separately. */
public class StoredRound {

    private String id;
    private String questionId;
    private int index;
    private Instant activatedAt;
    private long extensionMillis;
    private boolean closed;
    private CloseReason closeReason;
    private Instant closedAt;

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getQuestionId() { return questionId; }
    public void setQuestionId(String questionId) { this.questionId = questionId; }

    public int getIndex() { return index; }
    public void setIndex(int index) { this.index = index; }

    public Instant getActivatedAt() { return activatedAt; }
    public void setActivatedAt(Instant activatedAt) { this.activatedAt = activatedAt; }

    public long getExtensionMillis() { return extensionMillis; }
    public void setExtensionMillis(long extensionMillis) { this.extensionMillis = extensionMillis; }

    public boolean isClosed() { return closed; }
    public void setClosed(boolean closed) { this.closed = closed; }

    public CloseReason getCloseReason() { return closeReason; }
    public void setCloseReason(CloseReason closeReason) { this.closeReason = closeReason; }

    public Instant getClosedAt() { return closedAt; }
    public void setClosedAt(Instant closedAt) { this.closedAt = closedAt; }
}
