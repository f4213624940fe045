package com.example.livesession.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

public record MapLockRequest(@NotNull @JsonProperty("isLocked") Boolean isLocked) { }
