package com.ridedispatch.api.shared.outbox;

public enum OutboxStatus {
    PENDING,
    SENT,
    FAILED
}
