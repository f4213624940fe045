package com.example.livesession.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * The lesson segment the presenter is on, followed by participants like the map focus.
 *
 * @param segmentId   optional external id of the segment
 * @param segmentName optional display name
 */
public record SegmentState(int segmentIndex, String segmentId, String segmentName,
                           @JsonProperty("isPlaying") boolean playing, Instant syncedAt) {
}
