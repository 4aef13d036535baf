package com.portfolioanalysis.optimizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Portfolio optimizer: Monte Carlo efficient frontier over historical prices.
 */
@SpringBootApplication
public class PortfolioOptimizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PortfolioOptimizerApplication.class, args);
    }
}
