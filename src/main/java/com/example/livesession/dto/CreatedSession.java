package com.example.livesession.dto;

/** Returned once at creation; the presenter key is not retrievable later. */
public record CreatedSession(SessionView session, String presenterId, String presenterKey) { }
