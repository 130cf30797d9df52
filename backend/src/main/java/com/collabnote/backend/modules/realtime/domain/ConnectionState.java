package com.collabnote.backend.modules.realtime.domain;

public enum ConnectionState {
    CONNECTING,
    OPEN,
    CLOSED
}
