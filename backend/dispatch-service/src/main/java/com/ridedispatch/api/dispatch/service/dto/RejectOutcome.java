package com.ridedispatch.api.dispatch.service.dto;

public enum RejectOutcome {
    REJECTED,
    NOT_PENDING
}
