package com.marketpulse.api.controller;

import com.marketpulse.api.dto.request.CriteriaRequest;
import com.marketpulse.api.dto.request.ImpliedVolRequest;
import com.marketpulse.api.dto.request.PriceRequest;
import com.marketpulse.api.dto.request.RegimeRequest;
import com.marketpulse.api.dto.request.ScanRequest;
import com.marketpulse.api.dto.request.ScreenRequest;
import com.marketpulse.api.dto.request.SingleLegRequest;
import com.marketpulse.api.dto.request.StrategyRequest;
import com.marketpulse.api.dto.response.ScreenResponse;
import com.marketpulse.config.AnalysisConfig;
import com.marketpulse.domain.model.ImpliedVolResult;
import com.marketpulse.domain.model.MarketScanResult;
import com.marketpulse.domain.model.OptionPrice;
import com.marketpulse.domain.model.RegimeClassification;
import com.marketpulse.domain.model.ScreeningCriteria;
import com.marketpulse.domain.model.ScreeningResult;
import com.marketpulse.domain.model.SingleLegAnalysis;
import com.marketpulse.domain.model.StrategyAnalysis;
import com.marketpulse.mapper.OptionsRequestMapper;
import com.marketpulse.service.MarketScanService;
import com.marketpulse.service.OptionsAnalyticsService;
import jakarta.validation.Valid;
import org.mapstruct.factory.Mappers;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for option analytics. A thin adapter: requests are validated, mapped to
 * domain inputs and handed to {@link OptionsAnalyticsService}.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/options/price -- theoretical price and Greeks</li>
 *   <li>POST /api/options/implied-vol -- implied volatility from a market price</li>
 *   <li>POST /api/options/single-leg -- breakeven, payoff bounds, POP and payoff curve</li>
 *   <li>POST /api/options/strategy -- covered call and vertical spread composition</li>
 *   <li>POST /api/options/regime -- volatility regime of an index reading</li>
 *   <li>POST /api/options/screen -- ranked opportunities over caller-supplied chains</li>
 *   <li>POST /api/options/scan -- provider-backed screen over a list of symbols</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/options")
public class OptionsAnalyticsController {

    private final OptionsAnalyticsService optionsAnalyticsService;
    private final MarketScanService marketScanService;
    private final AnalysisConfig analysisConfig;
    private final OptionsRequestMapper optionsRequestMapper = Mappers.getMapper(OptionsRequestMapper.class);

    public OptionsAnalyticsController(
            OptionsAnalyticsService optionsAnalyticsService,
            MarketScanService marketScanService,
            AnalysisConfig analysisConfig) {
        this.optionsAnalyticsService = optionsAnalyticsService;
        this.marketScanService = marketScanService;
        this.analysisConfig = analysisConfig;
    }

    @PostMapping("/price")
    public ResponseEntity<OptionPrice> price(@Valid @RequestBody PriceRequest request) {
        OptionPrice price = optionsAnalyticsService.price(
                optionsRequestMapper.toContract(request.getContract()),
                request.getSpot(),
                request.getRiskFreeRate(),
                request.getDividendYield(),
                request.getVolatility(),
                request.getAsof());
        return ResponseEntity.ok(price);
    }

    @PostMapping("/implied-vol")
    public ResponseEntity<ImpliedVolResult> impliedVol(@Valid @RequestBody ImpliedVolRequest request) {
        ImpliedVolResult result = optionsAnalyticsService.solveImpliedVol(
                optionsRequestMapper.toContract(request.getContract()),
                request.getMarketPrice(),
                request.getSpot(),
                request.getRiskFreeRate(),
                request.getDividendYield(),
                request.getAsof());
        return ResponseEntity.ok(result);
    }

    @PostMapping("/single-leg")
    public ResponseEntity<SingleLegAnalysis> singleLeg(@Valid @RequestBody SingleLegRequest request) {
        SingleLegAnalysis analysis = optionsAnalyticsService.analyzeSingleLeg(
                optionsRequestMapper.toContract(request.getContract()),
                request.getDirection(),
                request.getContracts(),
                request.getPremium(),
                optionsRequestMapper.toMarketContext(request.getMarket()));
        return ResponseEntity.ok(analysis);
    }

    @PostMapping("/strategy")
    public ResponseEntity<StrategyAnalysis> strategy(@Valid @RequestBody StrategyRequest request) {
        StrategyAnalysis analysis = optionsAnalyticsService.composeStrategy(
                optionsRequestMapper.toStrategy(request, analysisConfig.getContractMultiplier()),
                optionsRequestMapper.toMarketContext(request.getMarket()));
        return ResponseEntity.ok(analysis);
    }

    @PostMapping("/regime")
    public ResponseEntity<RegimeClassification> regime(@Valid @RequestBody RegimeRequest request) {
        return ResponseEntity.ok(classify(request));
    }

    @PostMapping("/screen")
    public ResponseEntity<ScreenResponse> screen(@Valid @RequestBody ScreenRequest request) {
        RegimeClassification regime = request.getRegime() != null ? classify(request.getRegime()) : null;
        ScreeningResult screening = optionsAnalyticsService.screen(
                optionsRequestMapper.toUniverse(request.getUniverse()),
                optionsRequestMapper.toCriteria(request.getCriteria(), regime),
                regime,
                request.getAsof());
        return ResponseEntity.ok(ScreenResponse.builder()
                .screening(screening)
                .report(optionsAnalyticsService.report(screening.getOpportunities()))
                .build());
    }

    @PostMapping("/scan")
    public ResponseEntity<MarketScanResult> scan(@Valid @RequestBody ScanRequest request) {
        CriteriaRequest criteriaRequest = request.getCriteria();
        // The current regime picks the preset when none is named.
        RegimeClassification regime = criteriaRequest.getPreset() == null || criteriaRequest.isRegimeAware()
                ? marketScanService.currentRegime().orElse(null)
                : null;
        ScreeningCriteria criteria = optionsRequestMapper.toCriteria(criteriaRequest, regime);
        MarketScanResult result = marketScanService.scan(
                request.getSymbols(), criteria, criteria.isRegimeAware() ? regime : null, request.getAsof());
        return ResponseEntity.ok(result);
    }

    private RegimeClassification classify(RegimeRequest request) {
        return optionsAnalyticsService.classifyRegime(
                request.getCurrentLevel(), request.getHistory(), request.getBasis());
    }
}
