package com.multipost.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ExecutorConfiguration {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService publicationWorkerExecutor(MultipostRuntimeProperties multipostRuntimeProperties) {
        int concurrency = multipostRuntimeProperties.getWorker().getConcurrency();
        if (concurrency <= 0) {
            throw new IllegalStateException("multipost.worker.concurrency must be greater than zero");
        }
        return Executors.newFixedThreadPool(concurrency, new CustomizableThreadFactory("publication-worker-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService adaptationExecutor(AdaptationProperties adaptationProperties) {
        int concurrency = adaptationProperties.getConcurrency();
        if (concurrency <= 0) {
            throw new IllegalStateException("multipost.adaptation.concurrency must be greater than zero");
        }
        return Executors.newFixedThreadPool(concurrency, new CustomizableThreadFactory("content-adaptation-"));
    }
}
