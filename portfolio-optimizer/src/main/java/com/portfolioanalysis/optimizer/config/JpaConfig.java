package com.portfolioanalysis.optimizer.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * JPA configuration for the historical price store.
 */
@Configuration
@EnableJpaRepositories(basePackages = "com.portfolioanalysis.optimizer.repository")
@EnableTransactionManagement
public class JpaConfig {
}
