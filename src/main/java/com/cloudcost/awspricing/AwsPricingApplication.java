package com.cloudcost.awspricing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * AWS Public Pricing Cost Engine
 *
 * Single-region cost estimation for AWS resources from embedded public
 * on-demand pricing: projected monthly cost, actual cost over a window,
 * pricing specifications and SKU upgrade recommendations.
 */
@SpringBootApplication
public class AwsPricingApplication {

    public static void main(String[] args) {
        SpringApplication.run(AwsPricingApplication.class, args);
    }
}
