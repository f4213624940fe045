package com.example.livesession.model;

/**
 * Presenter options chosen when the session is created.
 * Mutable holder so JSON bodies may omit any field and keep the default.
 */
public class SessionSettings {

    /** 0 means unlimited. */
    private int maxParticipants = 0;
    private boolean allowLateJoin = true;
    private boolean showLeaderboard = true;
    private boolean showCorrectAnswers = true;
    private boolean pointsForSpeed = true;
    private boolean autoAdvance = false;
    private int autoAdvanceDelaySeconds = 5;

    public static SessionSettings defaults() {
        return new SessionSettings();
    }

    public SessionSettings copy() {
        SessionSettings s = new SessionSettings();
        s.maxParticipants = maxParticipants;
        s.allowLateJoin = allowLateJoin;
        s.showLeaderboard = showLeaderboard;
        s.showCorrectAnswers = showCorrectAnswers;
        s.pointsForSpeed = pointsForSpeed;
        s.autoAdvance = autoAdvance;
        s.autoAdvanceDelaySeconds = autoAdvanceDelaySeconds;
        return s;
    }

    public int getMaxParticipants() { return maxParticipants; }
    public void setMaxParticipants(int maxParticipants) { this.maxParticipants = Math.max(0, maxParticipants); }

    public boolean isAllowLateJoin() { return allowLateJoin; }
    public void setAllowLateJoin(boolean allowLateJoin) { this.allowLateJoin = allowLateJoin; }

    public boolean isShowLeaderboard() { return showLeaderboard; }
    public void setShowLeaderboard(boolean showLeaderboard) { this.showLeaderboard = showLeaderboard; }

    public boolean isShowCorrectAnswers() { return showCorrectAnswers; }
    public void setShowCorrectAnswers(boolean showCorrectAnswers) { this.showCorrectAnswers = showCorrectAnswers; }

    public boolean isPointsForSpeed() { return pointsForSpeed; }
    public void setPointsForSpeed(boolean pointsForSpeed) { this.pointsForSpeed = pointsForSpeed; }

    public boolean isAutoAdvance() { return autoAdvance; }
    public void setAutoAdvance(boolean autoAdvance) { this.autoAdvance = autoAdvance; }

    public int getAutoAdvanceDelaySeconds() { return autoAdvanceDelaySeconds; }
    public void setAutoAdvanceDelaySeconds(int autoAdvanceDelaySeconds) {
        this.autoAdvanceDelaySeconds = Math.max(0, autoAdvanceDelaySeconds);
    }

    @Override
    public String toString() {
        return "SessionSettings{" +
                "maxParticipants=" + maxParticipants +
                ", allowLateJoin=" + allowLateJoin +
                ", showLeaderboard=" + showLeaderboard +
                ", showCorrectAnswers=" + showCorrectAnswers +
                ", pointsForSpeed=" + pointsForSpeed +
                ", autoAdvance=" + autoAdvance +
                ", autoAdvanceDelaySeconds=" + autoAdvanceDelaySeconds +
                '}';
    }
}
