package com.convsync.gateway.session;

public enum SessionState {
    CONNECTING,
    CATCHING_UP,
    LIVE,
    CLOSING,
    CLOSED
}
