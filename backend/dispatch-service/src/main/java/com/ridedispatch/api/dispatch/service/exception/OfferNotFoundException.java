package com.ridedispatch.api.dispatch.service.exception;

import java.util.UUID;

public class OfferNotFoundException extends DispatchException {
    public OfferNotFoundException(UUID offerId) {
        super("Offer not found: " + offerId);
    }
}
