package com.marketpulse.domain.model;

import static com.marketpulse.domain.model.InputChecks.requirePositive;
import static com.marketpulse.domain.model.InputChecks.requirePresent;

import com.marketpulse.domain.enums.OptionType;
import com.marketpulse.exception.ValidationException;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A listed European option on one underlying, together with the quote it was
 * delivered with. Immutable once constructed.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class OptionContract {

    private final String symbol;
    private final double strike;
    private final LocalDate expiration;
    private final OptionType optionType;
    private final OptionQuote quote;

    @Builder(toBuilder = true)
    private OptionContract(
            String symbol, double strike, LocalDate expiration, OptionType optionType, OptionQuote quote) {
        if (symbol == null || symbol.isBlank()) {
            throw new ValidationException("symbol", symbol, "must not be blank");
        }
        this.symbol = symbol;
        this.strike = requirePositive("strike", strike);
        this.expiration = requirePresent("expiration", expiration);
        this.optionType = requirePresent("optionType", optionType);
        this.quote = quote != null ? quote : OptionQuote.EMPTY;
    }

    /** Calendar days from {@code asof} to expiration; negative once the contract has expired. */
    public long daysToExpiration(LocalDate asof) {
        return ChronoUnit.DAYS.between(asof, expiration);
    }
}
