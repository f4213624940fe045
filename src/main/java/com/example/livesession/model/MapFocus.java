package com.example.livesession.model;

import java.time.Instant;

/** The presenter's current map viewport, followed by participants in "follow along" mode. */
public record MapFocus(double latitude, double longitude, double zoom, Double bearing, Double pitch, Instant updatedAt) {
}
