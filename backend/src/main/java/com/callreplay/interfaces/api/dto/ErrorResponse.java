package com.callreplay.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
