package com.familygraph.model;

import java.time.Instant;

public record AuditEntry(
    Instant timestamp,
    String actor,
    String action,
    boolean success,
    String detail
) {}
