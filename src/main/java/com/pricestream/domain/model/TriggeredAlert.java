package com.pricestream.domain.model;

/** An alert that transitioned to triggered, paired with the snapshot that fired it. */
public record TriggeredAlert(Alert alert, PriceSnapshot snapshot) {}
