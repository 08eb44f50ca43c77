package com.ridedispatch.api.shared.constants;

public enum UserType {
    DRIVER,
    CUSTOMER;

    public static UserType fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("User type is required");
        }
        return UserType.valueOf(value.trim().toUpperCase());
    }
}
