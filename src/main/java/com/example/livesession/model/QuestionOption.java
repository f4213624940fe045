package com.example.livesession.model;

public record QuestionOption(String id, String text, boolean correct, int displayOrder) {
}
