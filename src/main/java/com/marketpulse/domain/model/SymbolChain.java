package com.marketpulse.domain.model;

import static com.marketpulse.domain.model.InputChecks.requireFinite;
import static com.marketpulse.domain.model.InputChecks.requireNonNegative;
import static com.marketpulse.domain.model.InputChecks.requirePositive;

import com.marketpulse.exception.ValidationException;
import java.util.List;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Everything the screener needs for one underlying: its spot, rate and dividend
 * yield, plus the listed contracts across the expirations being screened.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class SymbolChain {

    private final String symbol;
    private final double spot;
    private final double riskFreeRate;
    private final double dividendYield;
    private final List<OptionContract> contracts;

    @Builder
    private SymbolChain(
            String symbol, double spot, double riskFreeRate, double dividendYield, List<OptionContract> contracts) {
        if (symbol == null || symbol.isBlank()) {
            throw new ValidationException("symbol", symbol, "must not be blank");
        }
        this.symbol = symbol;
        this.spot = requirePositive("spot", spot);
        this.riskFreeRate = requireFinite("riskFreeRate", riskFreeRate);
        this.dividendYield = requireNonNegative("dividendYield", dividendYield);
        this.contracts = contracts != null ? List.copyOf(contracts) : List.of();
    }
}
