package com.pricestream.subscription;

/**
 * Per-connection transport the core writes to. Implementations must be safe to call
 * from multiple threads and must never throw from {@link #send} or {@link #close}:
 * failures are reported as {@link SendResult#CLOSED}.
 */
public interface ConnectionTransport {

    /** Stable identifier, unique among live connections. */
    String id();

    SendResult send(String text);

    void close(String reason);

    boolean isOpen();

    String remoteAddress();
}
