package com.marketpulse.unit.screener;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.marketpulse.domain.enums.OptionType;
import com.marketpulse.domain.enums.PositionDirection;
import com.marketpulse.domain.model.Greeks;
import com.marketpulse.domain.model.OptionContract;
import com.marketpulse.domain.model.ScoredOpportunity;
import com.marketpulse.domain.model.ScreeningReport;
import com.marketpulse.domain.model.SingleLegAnalysis;
import com.marketpulse.screener.ScreeningReportGenerator;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class ScreeningReportGeneratorTest {

    private final ScreeningReportGenerator generator = new ScreeningReportGenerator();

    private static ScoredOpportunity opportunity(double strike, double score, double pop, double delta) {
        OptionContract contract = OptionContract.builder()
                .symbol("DIA")
                .strike(strike)
                .expiration(LocalDate.of(2025, 7, 18))
                .optionType(OptionType.PUT)
                .build();
        SingleLegAnalysis analysis = SingleLegAnalysis.builder()
                .contract(contract)
                .direction(PositionDirection.LONG)
                .probabilityOfProfit(pop)
                .greeks(Greeks.builder().delta(delta).build())
                .build();
        return ScoredOpportunity.builder().contract(contract).analysis(analysis).score(score).build();
    }

    @Test
    void emptyListReportsZeros() {
        ScreeningReport report = generator.generate(List.of());

        assertThat(report.getTotalOpportunities()).isZero();
        assertThat(report.getTopPicks()).isEmpty();
        assertThat(report.getAverageScore()).isZero();
        assertThat(report.getSummary()).isEqualTo("No opportunities matched the screening criteria");
    }

    @Test
    void averagesUseAbsoluteDelta() {
        ScreeningReport report = generator.generate(List.of(
                opportunity(400, 80, 30, -0.30), opportunity(395, 70, 25, -0.20), opportunity(390, 60, 20, -0.10)));

        assertThat(report.getTotalOpportunities()).isEqualTo(3);
        assertThat(report.getAverageScore()).isCloseTo(70.0, within(1e-9));
        assertThat(report.getAverageProbability()).isCloseTo(25.0, within(1e-9));
        assertThat(report.getAverageDelta()).isCloseTo(0.20, within(1e-9));
        assertThat(report.getSummary()).contains("3 opportunities").contains("DIA");
    }

    @Test
    void topPicksAreCut() {
        ScreeningReport report = generator.generate(
                List.of(opportunity(400, 80, 30, -0.30), opportunity(395, 70, 25, -0.20), opportunity(390, 60, 20, -0.10)),
                2);

        assertThat(report.getTopPicks()).extracting(o -> o.getContract().getStrike()).containsExactly(400.0, 395.0);
    }
}
