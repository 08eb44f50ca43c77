package com.ridedispatch.api.shared.constants;

public enum ActorType {
    CUSTOMER,
    DRIVER,
    SYSTEM
}
