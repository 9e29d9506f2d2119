package com.pocketpilot.budget.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;

/**
 * Error body of every failed budget call; {@code path} is the request that failed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponseDto(String code, String message, String path, Map<String, Object> details, String traceId) {
}
