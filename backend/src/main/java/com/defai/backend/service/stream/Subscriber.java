package com.defai.backend.service.stream;

import java.io.IOException;

/**
 * Push destination owned by the {@link BroadcastHub} while connected.
 */
public interface Subscriber {

    String id();

    void send(String payload) throws IOException;

    default void close() {
    }
}
