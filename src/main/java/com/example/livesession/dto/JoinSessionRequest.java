package com.example.livesession.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record JoinSessionRequest(@NotBlank String code, @Size(max = 200) String displayName) { }
