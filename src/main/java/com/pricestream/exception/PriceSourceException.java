package com.pricestream.exception;

/** The upstream price feed could not be reached or returned an unusable response. */
public class PriceSourceException extends BaseException {

    public PriceSourceException(String message) {
        super(ErrorCode.PRICE_UNAVAILABLE, message);
    }

    public PriceSourceException(String message, Throwable cause) {
        super(ErrorCode.PRICE_UNAVAILABLE, message, cause);
    }
}
