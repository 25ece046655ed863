package com.rabs.backend.modules.loom.presentation.dto;

public record CancellationRequest(String type) {
}
