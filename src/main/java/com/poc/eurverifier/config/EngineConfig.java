package com.poc.eurverifier.config;

import com.poc.eurverifier.engine.CellPairLocator;
import com.poc.eurverifier.engine.ExchangeRate;
import com.poc.eurverifier.engine.RateConverter;
import com.poc.eurverifier.engine.VerificationEngine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the verification engine. The conversion rate is fixed at build time
 * and deliberately not bound to any property.
 */
@Configuration
public class EngineConfig {

    @Bean
    public ExchangeRate exchangeRate() {
        return ExchangeRate.BGN_EUR;
    }

    @Bean
    public RateConverter rateConverter(ExchangeRate exchangeRate) {
        return new RateConverter(exchangeRate);
    }

    @Bean
    public CellPairLocator cellPairLocator(RateConverter rateConverter) {
        return new CellPairLocator(rateConverter::isNumeric);
    }

    @Bean
    public VerificationEngine verificationEngine(RateConverter rateConverter, CellPairLocator cellPairLocator) {
        return new VerificationEngine(rateConverter, cellPairLocator);
    }
}
