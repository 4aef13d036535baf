package com.portfolioanalysis.optimizer.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Thread pool used to run large frontier samplings in parallel chunks.
 */
@Configuration
public class AsyncConfig {

    @Value("${portfolio.sampler.thread-count:4}")
    private int samplerThreadCount;

    @Bean(name = "samplerExecutorService", destroyMethod = "shutdown")
    public ExecutorService samplerExecutorService() {
        return Executors.newFixedThreadPool(samplerThreadCount,
                r -> {
                    Thread thread = new Thread(r);
                    thread.setName("FrontierSampler-" + thread.getId());
                    thread.setDaemon(true);
                    return thread;
                });
    }
}
