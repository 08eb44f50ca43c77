package com.ridedispatch.api.shared.constants;

public enum OfferStatus {
    PENDING,     // Waiting for the driver
    ACCEPTED,    // Driver won the ride
    REJECTED,    // Driver declined
    EXPIRED,     // Window elapsed or ride cancelled
    SUPERSEDED   // Another driver won
}
