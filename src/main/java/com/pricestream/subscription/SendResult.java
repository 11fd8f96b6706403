package com.pricestream.subscription;

/** Outcome of a single send on a {@link ConnectionTransport}. */
public enum SendResult {
    OK,

    /** The peer is gone or the send failed; the connection should be deregistered. */
    CLOSED
}
