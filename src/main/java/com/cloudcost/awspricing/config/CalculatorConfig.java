package com.cloudcost.awspricing.config;

import com.cloudcost.awspricing.calculator.CalculatorRegistry;
import com.cloudcost.awspricing.calculator.ServiceCostCalculator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Configuration for per-service cost calculators.
 */
@Configuration
@Slf4j
public class CalculatorConfig {

    @Bean
    public CalculatorRegistry calculatorRegistry(List<ServiceCostCalculator> calculators) {
        CalculatorRegistry registry = new CalculatorRegistry(calculators);
        log.info("Registered cost calculators for services: {}", registry.supportedServices());
        return registry;
    }
}
