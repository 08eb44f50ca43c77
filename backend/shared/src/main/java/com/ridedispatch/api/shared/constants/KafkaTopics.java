package com.ridedispatch.api.shared.constants;

public final class KafkaTopics {

    public static final String RIDE_STATUS_EVENTS = "ride-status-events";
    public static final String DRIVER_LOCATION_UPDATES = "driver-location-updates";

    private KafkaTopics() {
    }
}
