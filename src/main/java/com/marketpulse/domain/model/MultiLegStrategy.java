package com.marketpulse.domain.model;

import static com.marketpulse.domain.model.InputChecks.requirePresent;

import com.marketpulse.domain.enums.StrategyType;
import com.marketpulse.exception.ValidationException;
import java.time.LocalDate;
import java.util.List;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * An ordered, non-empty set of legs on one underlying and one expiration, tagged with
 * the template that interprets it. {@code sharesHeld} is the stock position backing a
 * covered call and is zero for pure option strategies.
 *
 * <p>Calendar spreads are not supported: every leg must share the first leg's expiration.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class MultiLegStrategy {

    private final StrategyType strategyType;
    private final List<StrategyLeg> legs;
    private final int sharesHeld;

    @Builder
    private MultiLegStrategy(StrategyType strategyType, List<StrategyLeg> legs, int sharesHeld) {
        this.strategyType = requirePresent("strategyType", strategyType);
        if (legs == null || legs.isEmpty()) {
            throw new ValidationException("legs", legs, "a strategy needs at least one leg");
        }
        if (sharesHeld < 0) {
            throw new ValidationException("sharesHeld", sharesHeld, "must not be negative");
        }

        OptionContract first = legs.get(0).getContract();
        for (StrategyLeg leg : legs) {
            OptionContract contract = leg.getContract();
            if (!first.getSymbol().equals(contract.getSymbol())) {
                throw new ValidationException(
                        "legs",
                        contract.getSymbol(),
                        "all legs must share underlying " + first.getSymbol());
            }
            if (!first.getExpiration().equals(contract.getExpiration())) {
                throw new ValidationException(
                        "legs",
                        contract.getExpiration(),
                        "all legs must share expiration " + first.getExpiration());
            }
        }

        this.legs = List.copyOf(legs);
        this.sharesHeld = sharesHeld;
    }

    public String getUnderlying() {
        return legs.get(0).getContract().getSymbol();
    }

    public LocalDate getExpiration() {
        return legs.get(0).getContract().getExpiration();
    }
}
