package com.marketpulse.api.dto.request;

import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

/** Market quote of one contract. Missing prices are treated as "not quoted". */
@Data
public class QuoteRequest {

    @PositiveOrZero(message = "bid must not be negative")
    private double bid;

    @PositiveOrZero(message = "ask must not be negative")
    private double ask;

    @PositiveOrZero(message = "last must not be negative")
    private double last;

    @PositiveOrZero(message = "volume must not be negative")
    private long volume;

    @PositiveOrZero(message = "openInterest must not be negative")
    private long openInterest;

    /** Observed implied volatility as a decimal, optional. */
    @PositiveOrZero(message = "impliedVolatility must not be negative")
    private Double impliedVolatility;
}
