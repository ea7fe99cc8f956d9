package com.ospicorp.energyapi.alert.model;

import java.time.Instant;

public record Alert(AlertLevel level, String message, Instant timestamp) {}
