package com.marketpulse.domain.model;

import static com.marketpulse.domain.model.InputChecks.requireNonNegative;
import static com.marketpulse.domain.model.InputChecks.requirePresent;

import com.marketpulse.domain.enums.PositionDirection;
import com.marketpulse.exception.ValidationException;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One leg of a multi-leg strategy. Quantity is always positive; the side is carried by
 * {@link #getDirection()}.
 *
 * <p>{@code premium} optionally pins the per-share price paid or collected for the leg
 * (e.g. a fill price). When null the contract's quote mid is used.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class StrategyLeg {

    private final OptionContract contract;
    private final PositionDirection direction;
    private final int quantity;
    private final Double premium;

    @Builder
    private StrategyLeg(OptionContract contract, PositionDirection direction, int quantity, Double premium) {
        this.contract = requirePresent("contract", contract);
        this.direction = requirePresent("direction", direction);
        if (quantity <= 0) {
            throw new ValidationException("quantity", quantity, "must be positive");
        }
        if (premium != null) {
            requireNonNegative("premium", premium);
        }
        this.quantity = quantity;
        this.premium = premium;
    }

    public boolean isLong() {
        return direction == PositionDirection.LONG;
    }

    public double getStrike() {
        return contract.getStrike();
    }
}
