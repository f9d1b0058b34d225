package com.scholary.audiobook.api;

import java.util.List;

/** A page of a job's event stream; poll again from {@code nextOffset}. */
public record JobEventsResponse(
    String jobId, List<String> lines, long nextOffset, boolean finished) {}
