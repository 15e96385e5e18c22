package org.nowstart.tradecore.strategy.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.nowstart.tradecore.data.property.TradingProperties;
import org.nowstart.tradecore.data.type.IndicatorKind;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class AdaptiveStrategyConfigBindingTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    ConfigurationPropertiesAutoConfiguration.class,
                    ValidationAutoConfiguration.class
            ))
            .withUserConfiguration(PropertiesTestConfig.class)
            .withPropertyValues(
                    "tradecore.adaptive.bullish-strategy.name=Bull",
                    "tradecore.adaptive.bullish-strategy.indicators[0].kind=MACD",
                    "tradecore.adaptive.bullish-strategy.indicators[0].weight=1.0",
                    "tradecore.adaptive.bullish-strategy.indicators[0].params.fastPeriod=9",
                    "tradecore.adaptive.bullish-strategy.buy-threshold=0.4",
                    "tradecore.adaptive.bullish-strategy.sell-threshold=-0.4",
                    "tradecore.adaptive.bullish-strategy.max-position-fraction=0.9",
                    "tradecore.adaptive.bullish-strategy.initial-capital=1000",
                    "tradecore.adaptive.bearish-strategy.name=Bear",
                    "tradecore.adaptive.bearish-strategy.buy-threshold=0.6",
                    "tradecore.adaptive.bearish-strategy.sell-threshold=-0.2",
                    "tradecore.adaptive.bearish-strategy.max-position-fraction=0.3",
                    "tradecore.adaptive.bearish-strategy.initial-capital=1000"
            );

    @Test
    void bindsAdaptiveConfigWithDefaults() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            AdaptiveStrategyConfig config = context.getBean(AdaptiveStrategyConfig.class);
            assertThat(config.bullishStrategy().name()).isEqualTo("Bull");
            assertThat(config.bullishStrategy().timeframe()).isEqualTo("1d");
            assertThat(config.bullishStrategy().indicators().get(0).kind()).isEqualTo(IndicatorKind.MACD);
            assertThat(config.bullishStrategy().indicators().get(0).intParam("fastPeriod", 12)).isEqualTo(9);
            assertThat(config.maxDrawdownThreshold()).isEqualTo(0.2);
            assertThat(config.whipsawDetectionPeriods()).isEqualTo(5);
            assertThat(config.neutralStrategy()).isNull();

            TradingProperties trading = context.getBean(TradingProperties.class);
            assertThat(trading.feeRate()).isEqualTo(0.001);
            assertThat(trading.activeStrategyVersion()).isEqualTo("adaptive");
        });
    }

    @Test
    void failsOnOutOfRangeThreshold() {
        contextRunner
                .withPropertyValues("tradecore.adaptive.max-drawdown-threshold=1.5")
                .run(context -> assertThat(context).hasFailed());
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties({TradingProperties.class, AdaptiveStrategyConfig.class})
    static class PropertiesTestConfig {
    }
}
