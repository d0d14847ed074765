package com.defai.backend.service.stream;

public enum SubscriberState {
    CONNECTING,
    CONNECTED,
    DISCONNECTED
}
