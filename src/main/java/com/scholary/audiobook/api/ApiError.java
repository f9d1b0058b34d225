package com.scholary.audiobook.api;

import java.time.Instant;
import java.util.List;

/** Error body returned by {@link GlobalExceptionHandler}. */
public record ApiError(
    String code, String message, List<String> details, String path, Instant timestamp) {}
