package com.ridedispatch.api.dispatch.service.registry;

import java.io.IOException;

/**
 * A live, bidirectional channel to one client device.
 */
public interface ClientConnection {

    String getId();

    boolean isOpen();

    void send(String text) throws IOException;
}
