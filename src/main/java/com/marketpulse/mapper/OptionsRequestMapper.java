package com.marketpulse.mapper;

import com.marketpulse.api.dto.request.ContractRequest;
import com.marketpulse.api.dto.request.CriteriaRequest;
import com.marketpulse.api.dto.request.LegRequest;
import com.marketpulse.api.dto.request.MarketContextRequest;
import com.marketpulse.api.dto.request.QuoteRequest;
import com.marketpulse.api.dto.request.StrategyRequest;
import com.marketpulse.api.dto.request.SymbolChainRequest;
import com.marketpulse.domain.enums.StrategyPreference;
import com.marketpulse.domain.enums.StrategyType;
import com.marketpulse.domain.model.MarketContext;
import com.marketpulse.domain.model.MultiLegStrategy;
import com.marketpulse.domain.model.OptionContract;
import com.marketpulse.domain.model.OptionQuote;
import com.marketpulse.domain.model.RegimeClassification;
import com.marketpulse.domain.model.ScreeningCriteria;
import com.marketpulse.domain.model.StrategyLeg;
import com.marketpulse.domain.model.SymbolChain;
import com.marketpulse.screener.ScreeningPresets;
import java.util.List;
import java.util.stream.Collectors;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper from REST request DTOs to the immutable domain inputs.
 *
 * <p>Domain types are built through their Lombok builders, so their constructor checks
 * still run: a DTO that passes Bean Validation can fail here with a
 * {@link com.marketpulse.exception.ValidationException} (e.g. legs on different
 * expirations) or a {@link com.marketpulse.exception.ConfigurationException} (an inverted
 * screening band).
 *
 * <p>Strategies and criteria carry defaulting rules and are mapped by hand.
 */
@Mapper
public interface OptionsRequestMapper {

    OptionQuote toQuote(QuoteRequest request);

    OptionContract toContract(ContractRequest request);

    List<OptionContract> toContracts(List<ContractRequest> requests);

    MarketContext toMarketContext(MarketContextRequest request);

    SymbolChain toSymbolChain(SymbolChainRequest request);

    List<SymbolChain> toUniverse(List<SymbolChainRequest> requests);

    /**
     * Legs without a quantity default to one contract, or for a covered call to as many
     * contracts as the shares held cover.
     */
    default MultiLegStrategy toStrategy(StrategyRequest request, int contractMultiplier) {
        int defaultQuantity = request.getStrategyType() == StrategyType.COVERED_CALL
                ? Math.max(1, request.getSharesHeld() / contractMultiplier)
                : 1;

        List<StrategyLeg> legs = request.getLegs().stream()
                .map(leg -> toLeg(leg, defaultQuantity))
                .collect(Collectors.toList());

        return MultiLegStrategy.builder()
                .strategyType(request.getStrategyType())
                .legs(legs)
                .sharesHeld(request.getSharesHeld())
                .build();
    }

    default StrategyLeg toLeg(LegRequest request, int defaultQuantity) {
        return StrategyLeg.builder()
                .contract(toContract(request.getContract()))
                .direction(request.getDirection())
                .quantity(request.getQuantity() != null ? request.getQuantity() : defaultQuantity)
                .premium(request.getPremium())
                .build();
    }

    /** Starts from the named preset (NEUTRAL when none) and overrides whatever the request sets. */
    default ScreeningCriteria toCriteria(CriteriaRequest request) {
        return toCriteria(request, null);
    }

    /**
     * Starts from the named preset; without one, from the preset the regime prefers (low
     * volatility sells premium, high volatility goes directional), or NEUTRAL when there is
     * no regime either. Fields the request sets override the preset.
     *
     * @param regime optional current volatility regime
     */
    default ScreeningCriteria toCriteria(CriteriaRequest request, RegimeClassification regime) {
        ScreeningCriteria preset;
        if (request.getPreset() != null) {
            preset = ScreeningPresets.forPreference(request.getPreset(), request.getScreenType());
        } else if (regime != null) {
            preset = ScreeningPresets.forRegime(regime, request.getScreenType());
        } else {
            preset = ScreeningPresets.forPreference(StrategyPreference.NEUTRAL, request.getScreenType());
        }

        return ScreeningCriteria.builder()
                .screenType(request.getScreenType())
                .minDelta(request.getMinDelta() != null ? request.getMinDelta() : preset.getMinDelta())
                .maxDelta(request.getMaxDelta() != null ? request.getMaxDelta() : preset.getMaxDelta())
                .minDaysToExpiry(
                        request.getMinDaysToExpiry() != null ? request.getMinDaysToExpiry() : preset.getMinDaysToExpiry())
                .maxDaysToExpiry(
                        request.getMaxDaysToExpiry() != null ? request.getMaxDaysToExpiry() : preset.getMaxDaysToExpiry())
                .minVolume(request.getMinVolume() != null ? request.getMinVolume() : preset.getMinVolume())
                .minOpenInterest(
                        request.getMinOpenInterest() != null ? request.getMinOpenInterest() : preset.getMinOpenInterest())
                .regimeAware(request.isRegimeAware())
                .topN(request.getTopN())
                .targetDelta(request.getTargetDelta())
                .build();
    }
}
