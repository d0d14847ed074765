package com.defai.backend.service.stream;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

class RecordingSubscriber implements Subscriber {

    private final String id;
    private final List<String> received = new CopyOnWriteArrayList<>();
    private volatile int failAfter;
    private volatile boolean closed;

    RecordingSubscriber(String id) {
        this(id, Integer.MAX_VALUE);
    }

    /**
     * Fails every send after the first {@code failAfter} succeed.
     */
    RecordingSubscriber(String id, int failAfter) {
        this.id = id;
        this.failAfter = failAfter;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void send(String payload) throws IOException {
        if (received.size() >= failAfter) {
            throw new IOException("broken pipe");
        }
        received.add(payload);
    }

    @Override
    public void close() {
        closed = true;
    }

    void failFromNowOn() {
        failAfter = received.size();
    }

    List<String> received() {
        return received;
    }

    String last() {
        return received.get(received.size() - 1);
    }

    boolean isClosed() {
        return closed;
    }
}
