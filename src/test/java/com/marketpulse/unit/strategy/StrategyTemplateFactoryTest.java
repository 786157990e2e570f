package com.marketpulse.unit.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.marketpulse.domain.enums.StrategyType;
import com.marketpulse.exception.ConfigurationException;
import com.marketpulse.strategy.StrategyTemplateFactory;
import com.marketpulse.strategy.impl.BearPutSpreadTemplate;
import com.marketpulse.strategy.impl.BullCallSpreadTemplate;
import java.util.List;
import org.junit.jupiter.api.Test;

class StrategyTemplateFactoryTest {

    private final StrategyTemplateFactory factory =
            new StrategyTemplateFactory(List.of(new BullCallSpreadTemplate(), new BearPutSpreadTemplate()));

    @Test
    void resolvesTemplateByType() {
        assertThat(factory.getTemplate(StrategyType.BULL_CALL_SPREAD)).isInstanceOf(BullCallSpreadTemplate.class);
        assertThat(factory.getTemplate(StrategyType.BEAR_PUT_SPREAD).getType()).isEqualTo(StrategyType.BEAR_PUT_SPREAD);
    }

    @Test
    void unregisteredTypeIsAConfigurationError() {
        assertThatThrownBy(() -> factory.getTemplate(StrategyType.COVERED_CALL))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("COVERED_CALL");
    }
}
