package com.example.livesession.event;

import com.fasterxml.jackson.annotation.JsonValue;

/** Server-to-client event catalogue; the wire name is what clients switch on. */
public enum EventType {

    SESSION_STATUS_CHANGED("SessionStatusChanged"),
    PARTICIPANT_JOINED("ParticipantJoined"),
    PARTICIPANT_LEFT("ParticipantLeft"),
    QUESTION_ACTIVATED("QuestionActivated"),
    TIME_EXTENDED("TimeExtended"),
    QUESTION_SKIPPED("QuestionSkipped"),
    QUESTION_CLOSED("QuestionClosed"),
    RESPONSE_SUBMITTED("ResponseSubmitted"),
    LEADERBOARD_UPDATED("LeaderboardUpdated"),
    TEACHER_FOCUS_CHANGED("TeacherFocusChanged"),
    MAP_LOCK_STATE_SYNC("MapLockStateSync"),
    SEGMENT_SYNC("SegmentSync"),
    MAP_LAYER_SYNC("MapLayerSync"),
    QUESTION_RESULTS("QuestionResults"),
    SESSION_ENDED("SessionEnded");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
