package com.xksgroup.conversionengine.client;

public enum ConnectionState {
    DISCONNECTED,   // Never connected yet
    CONNECTING,     // First connection attempt in progress
    CONNECTED,      // Stream open and Connected envelope received
    RECONNECTING,   // Lost the stream, waiting for the next attempt
    FAILED,         // Gave up after the last allowed attempt
    CLOSED          // Closed by the caller
}
