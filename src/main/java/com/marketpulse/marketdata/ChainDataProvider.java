package com.marketpulse.marketdata;

import com.marketpulse.domain.model.OptionContract;
import java.time.LocalDate;
import java.util.List;

/**
 * Source of listed option chains and underlying prices. Implemented outside this
 * project (broker or market-data vendor adapters); the analytics only consume it.
 *
 * <p>Implementations may throw any runtime exception on I/O failure. Callers that fan
 * out over symbols treat such a failure as "skip this symbol".
 */
public interface ChainDataProvider {

    /** Listed expirations for the symbol, ascending. */
    List<LocalDate> getExpirations(String symbol);

    /** Calls and puts for one expiration, each with its current quote. */
    List<OptionContract> getChain(String symbol, LocalDate expiration);

    double getUnderlyingPrice(String symbol);
}
