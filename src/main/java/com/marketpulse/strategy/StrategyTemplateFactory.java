package com.marketpulse.strategy;

import com.marketpulse.domain.enums.StrategyType;
import com.marketpulse.exception.ConfigurationException;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Resolves a {@link StrategyTemplate} implementation by {@link StrategyType}.
 *
 * <p>Spring discovers all template beans and this factory indexes them by type at
 * construction time. A missing template is a wiring error, not bad input.
 */
@Component
public class StrategyTemplateFactory {

    private final Map<StrategyType, StrategyTemplate> templatesByType;

    public StrategyTemplateFactory(List<StrategyTemplate> strategyTemplates) {
        this.templatesByType =
                strategyTemplates.stream().collect(Collectors.toMap(StrategyTemplate::getType, Function.identity()));
    }

    /**
     * @throws ConfigurationException if no template is registered for the type
     */
    public StrategyTemplate getTemplate(StrategyType strategyType) {
        StrategyTemplate template = templatesByType.get(strategyType);
        if (template == null) {
            throw new ConfigurationException("No strategy template registered for type: " + strategyType);
        }
        return template;
    }
}
