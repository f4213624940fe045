package com.example.livesession.dto;

import java.util.List;

/** Normalized answers with their counts, most frequent first. */
public record WordCloudData(String roundId, String questionId, int totalResponses, List<Entry> words) {

    /** @param frequency share of all responses in percent, one decimal */
    public record Entry(String word, int count, double frequency) { }
}
