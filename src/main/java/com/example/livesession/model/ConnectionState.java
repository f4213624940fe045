package com.example.livesession.model;

public enum ConnectionState {
    CONNECTED,
    DISCONNECTED
}
