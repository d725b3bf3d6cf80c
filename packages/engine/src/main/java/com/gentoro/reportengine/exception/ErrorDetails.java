package com.gentoro.reportengine.exception;

import java.time.Instant;
import java.util.Map;

/** Flattened view of a failure, suitable for logging or for handing to a caller as plain data. */
public record ErrorDetails(
    String type,
    String message,
    ReportEngineErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}
