package com.ridedispatch.api.shared.constants;

/**
 * Event names pushed over live client connections.
 */
public final class RealtimeEvents {

    // Driver channel
    public static final String RIDE_REQUEST_NEW = "ride:request:new";
    public static final String RIDE_REQUEST_CANCELLED = "ride:request:cancelled";
    public static final String RIDE_REQUEST_RESPOND_RESULT = "ride:request:respond:result";

    // Customer channel
    public static final String RIDE_DRIVER_ASSIGNED = "ride:driver:assigned";
    public static final String RIDE_NO_DRIVERS_AVAILABLE = "ride:status:no_drivers_available";

    // Both
    public static final String RIDE_STATUS_UPDATED = "ride:status:updated";
    public static final String CONNECTED = "connected";
    public static final String PONG = "pong";
    public static final String ERROR = "error";

    // Inbound from clients
    public static final String PING = "ping";
    public static final String DRIVER_LOCATION_UPDATE = "driver:location:update";
    public static final String DRIVER_AVAILABILITY_UPDATE = "driver:availability:update";
    public static final String RIDE_REQUEST_RESPOND = "ride:request:respond";

    // Cancellation reasons sent with RIDE_REQUEST_CANCELLED
    public static final String REASON_ACCEPTED_BY_ANOTHER_DRIVER = "accepted_by_another_driver";
    public static final String REASON_CANCELLED_BY_CUSTOMER = "cancelled_by_customer";

    private RealtimeEvents() {
    }
}
