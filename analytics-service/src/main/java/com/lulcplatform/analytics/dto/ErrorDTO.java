package com.lulcplatform.analytics.dto;

public record ErrorDTO(
    String error,
    String subject,
    String message
) {}
