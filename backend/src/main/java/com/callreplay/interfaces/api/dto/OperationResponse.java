package com.callreplay.interfaces.api.dto;

public record OperationResponse(boolean success, String message) {}
