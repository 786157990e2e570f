package com.marketpulse.strategy.impl;

import com.marketpulse.domain.enums.OptionType;
import com.marketpulse.domain.model.MultiLegStrategy;
import com.marketpulse.domain.model.PayoffBound;
import com.marketpulse.domain.model.StrategyLeg;
import com.marketpulse.exception.ValidationException;
import com.marketpulse.strategy.StrategyContext;
import com.marketpulse.strategy.StrategyOutcome;
import com.marketpulse.strategy.StrategyTemplate;
import java.util.List;

/**
 * Base for two-leg vertical spreads: one long and one short option of the same type,
 * same quantity, different strikes.
 *
 * <p>With W the strike width and D the net debit per share (negative for a credit):
 * <ul>
 *   <li>debit spread: max profit W - D, max loss D</li>
 *   <li>credit spread: max profit -D, max loss W + D</li>
 * </ul>
 * Subclasses fix the option type, the side of the market they profit on, and the
 * breakeven formula.
 */
public abstract class AbstractVerticalSpreadTemplate implements StrategyTemplate {

    /** Option type of both legs. */
    protected abstract OptionType optionType();

    /** True when the spread profits from the underlying rising. */
    protected abstract boolean isBullish();

    /** Breakeven price at expiration given the two strikes and the net debit per share. */
    protected abstract double breakeven(double longStrike, double shortStrike, double netDebit);

    /** Bull call and bear put are paid for; bull put and bear call collect a credit. */
    protected boolean isDebitSpread() {
        return isBullish() == optionType().isCall();
    }

    @Override
    public void validateLegs(MultiLegStrategy strategy) {
        List<StrategyLeg> legs = strategy.getLegs();
        if (legs.size() != 2) {
            throw new ValidationException("legs", legs.size(), getType() + " needs exactly two legs");
        }
        for (StrategyLeg leg : legs) {
            if (leg.getContract().getOptionType() != optionType()) {
                throw new ValidationException(
                        "legs", leg.getContract().getOptionType(), getType() + " legs must all be " + optionType());
            }
        }

        StrategyLeg longLeg = longLeg(strategy);
        StrategyLeg shortLeg = shortLeg(strategy);
        if (longLeg == null || shortLeg == null) {
            throw new ValidationException("legs", strategy.getLegs(), getType() + " needs one long and one short leg");
        }
        if (longLeg.getQuantity() != shortLeg.getQuantity()) {
            throw new ValidationException(
                    "quantity",
                    longLeg.getQuantity() + "/" + shortLeg.getQuantity(),
                    getType() + " legs must have equal quantities");
        }

        // Bullish spreads buy the lower strike, bearish spreads buy the higher one
        boolean longBelowShort = longLeg.getStrike() < shortLeg.getStrike();
        boolean longAboveShort = longLeg.getStrike() > shortLeg.getStrike();
        if (isBullish() ? !longBelowShort : !longAboveShort) {
            throw new ValidationException(
                    "strikes",
                    longLeg.getStrike() + "/" + shortLeg.getStrike(),
                    getType() + " must be long the " + (isBullish() ? "lower" : "higher") + " strike");
        }
    }

    @Override
    public StrategyOutcome evaluate(StrategyContext context) {
        MultiLegStrategy strategy = context.getStrategy();
        StrategyLeg longLeg = longLeg(strategy);
        StrategyLeg shortLeg = shortLeg(strategy);

        double positionSize = (double) longLeg.getQuantity() * context.getMultiplier();
        double netDebit = context.getNetPremium() / longLeg.getQuantity();
        double width = Math.abs(shortLeg.getStrike() - longLeg.getStrike());

        double maxProfitPerShare = isDebitSpread() ? width - netDebit : -netDebit;
        double maxLossPerShare = isDebitSpread() ? netDebit : width + netDebit;
        double breakeven = breakeven(longLeg.getStrike(), shortLeg.getStrike(), netDebit);

        double probability =
                isBullish() ? context.probabilityAbovePct(breakeven) : context.probabilityBelowPct(breakeven);

        return StrategyOutcome.builder()
                .breakevens(List.of(breakeven))
                .maxProfit(PayoffBound.of(maxProfitPerShare, maxProfitPerShare * positionSize))
                .maxLoss(PayoffBound.of(maxLossPerShare, maxLossPerShare * positionSize))
                .probabilityOfProfit(probability)
                .spreadWidth(width)
                .build();
    }

    private static StrategyLeg longLeg(MultiLegStrategy strategy) {
        return strategy.getLegs().stream().filter(StrategyLeg::isLong).findFirst().orElse(null);
    }

    private static StrategyLeg shortLeg(MultiLegStrategy strategy) {
        return strategy.getLegs().stream().filter(leg -> !leg.isLong()).findFirst().orElse(null);
    }
}
