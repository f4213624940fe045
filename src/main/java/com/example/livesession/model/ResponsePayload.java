package com.example.livesession.model;

/**
 * What a participant submitted. Which field is relevant depends on the question type:
 * option id for choice questions, text for short answer and word cloud, coordinate for pin-on-map.
 */
public record ResponsePayload(String optionId, String text, Double latitude, Double longitude) {

    public static ResponsePayload option(String optionId) {
        return new ResponsePayload(optionId, null, null, null);
    }

    public static ResponsePayload text(String text) {
        return new ResponsePayload(null, text, null, null);
    }

    public static ResponsePayload pin(double latitude, double longitude) {
        return new ResponsePayload(null, null, latitude, longitude);
    }

    public boolean hasCoordinate() {
        return latitude != null && longitude != null;
    }

    public GeoPoint coordinate() {
        if (!hasCoordinate()) return null;
        return new GeoPoint(latitude, longitude);
    }
}
