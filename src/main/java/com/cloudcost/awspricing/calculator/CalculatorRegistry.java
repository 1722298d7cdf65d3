package com.cloudcost.awspricing.calculator;

import com.cloudcost.awspricing.domain.model.ServiceIdentifier;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Dispatch table from service to its calculator.
 *
 * Built once from every registered calculator. Two calculators claiming
 * the same service is a wiring error.
 */
public class CalculatorRegistry {

    private final Map<ServiceIdentifier, ServiceCostCalculator> calculators;

    public CalculatorRegistry(List<ServiceCostCalculator> registered) {
        Map<ServiceIdentifier, ServiceCostCalculator> byService = new EnumMap<>(ServiceIdentifier.class);
        for (ServiceCostCalculator calculator : registered) {
            for (ServiceIdentifier service : calculator.getServices()) {
                ServiceCostCalculator previous = byService.put(service, calculator);
                if (previous != null) {
                    throw new IllegalStateException("Service " + service + " is claimed by both "
                            + previous.getClass().getSimpleName() + " and " + calculator.getClass().getSimpleName());
                }
            }
        }
        this.calculators = Collections.unmodifiableMap(byService);
    }

    public Optional<ServiceCostCalculator> forService(ServiceIdentifier service) {
        return Optional.ofNullable(calculators.get(service));
    }

    public Set<ServiceIdentifier> supportedServices() {
        return calculators.keySet();
    }
}
