package com.ridedispatch.api.dispatch.service.registry;

public enum SendResult {
    DELIVERED,
    NOT_CONNECTED
}
