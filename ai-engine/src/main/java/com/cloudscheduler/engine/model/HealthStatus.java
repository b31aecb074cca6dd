package com.cloudscheduler.engine.model;

import java.time.Instant;

public record HealthStatus(String status, String message, Instant timestamp) {}
