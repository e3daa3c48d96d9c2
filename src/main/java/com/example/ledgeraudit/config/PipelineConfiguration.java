package com.example.ledgeraudit.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Infrastructure beans shared by the batch pipeline.
 */
@Configuration
public class PipelineConfiguration {

    /**
     * Bounded pool running per-document stages. Shared across batches; the batch barrier waits on futures,
     * never on the pool itself.
     */
    @Bean(name = "ledgerWorkerPool", destroyMethod = "shutdown")
    public ExecutorService ledgerWorkerPool(LedgerProperties properties) {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("ledger-worker-");
        threadFactory.setDaemon(true);
        return Executors.newFixedThreadPool(properties.pipeline().workerThreads(), threadFactory);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
