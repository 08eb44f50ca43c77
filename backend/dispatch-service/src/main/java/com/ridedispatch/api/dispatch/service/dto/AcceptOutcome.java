package com.ridedispatch.api.dispatch.service.dto;

public enum AcceptOutcome {
    WON,
    LOST_RACE,          // another driver holds the ride
    EXPIRED,            // offer window passed or offer no longer pending
    RIDE_NOT_SEARCHING, // cancelled, exhausted, or already won by this driver
    NO_OFFER,           // driver was never offered this ride
    DRIVER_BUSY         // driver already holds another active ride
}
