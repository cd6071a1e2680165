package dev.vigil.dto.response;

public record AssistantResponse(String action, String output) {}
