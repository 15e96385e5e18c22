package org.nowstart.tradecore.strategy;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class StrategyBootstrapValidator {

    private final StrategyParamResolver strategyParamResolver;
    private final StrategyRegistry strategyRegistry;

    @PostConstruct
    void validate() {
        String activeVersion = strategyParamResolver.resolveActiveStrategyVersion();
        strategyRegistry.getRequired(activeVersion);
        int warmup = strategyRegistry.requiredWarmupBars(activeVersion, strategyParamResolver.resolve(activeVersion));
        log.info("Strategy engine ready. version={}, warmupBars={}, registered={}", activeVersion, warmup, strategyRegistry.versions());
    }
}
