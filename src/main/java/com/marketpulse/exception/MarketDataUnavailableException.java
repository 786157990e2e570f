package com.marketpulse.exception;

public class MarketDataUnavailableException extends BaseException {

    public MarketDataUnavailableException(String message) {
        super(ErrorCode.DATA_UNAVAILABLE, message);
    }

    public MarketDataUnavailableException(String message, Throwable cause) {
        super(ErrorCode.DATA_UNAVAILABLE, message, cause);
    }
}
