package com.cadenceai.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
