package com.example.livesession.dto;

import jakarta.validation.constraints.NotBlank;

public record MapLayerRequest(@NotBlank String layerKey) { }
