package com.example.livesession.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum QuestionType {

    MULTIPLE_CHOICE("MultipleChoice"),
    TRUE_FALSE("TrueFalse"),
    SHORT_ANSWER("ShortAnswer"),
    WORD_CLOUD("WordCloud"),
    PIN_ON_MAP("PinOnMap");

    private final String wireName;

    QuestionType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** Option based questions are answered by picking an option id. */
    public boolean usesOptions() {
        return this == MULTIPLE_CHOICE || this == TRUE_FALSE;
    }

    /** Word clouds collect answers without judging them. */
    public boolean isScored() {
        return this != WORD_CLOUD;
    }

    /** Accepts "MultipleChoice", "MULTIPLE_CHOICE", "multiple-choice", ... */
    @JsonCreator
    public static QuestionType fromWire(String raw) {
        if (raw == null) return null;
        String compact = raw.trim().replace("_", "").replace("-", "").replace(" ", "").toLowerCase(Locale.ROOT);
        for (QuestionType t : values()) {
            if (t.wireName.toLowerCase(Locale.ROOT).equals(compact)) return t;
        }
        throw new IllegalArgumentException("Unknown question type: " + raw);
    }
}
