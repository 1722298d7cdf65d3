package com.cloudcost.awspricing.pricing;

public record NatGatewayRate(
        double hourly,
        double dataPerGb
) {}
