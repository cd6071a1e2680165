package dev.vigil.dto.request;

public record ModelSelectionRequest(String model) {}
