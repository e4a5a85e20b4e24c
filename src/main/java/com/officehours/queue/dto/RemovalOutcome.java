package com.officehours.queue.dto;

public enum RemovalOutcome {
    REMOVED,
    ALREADY_REMOVED
}
