package com.xksgroup.conversionengine.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class EngineConfig {

    /**
     * Threads that write queued envelopes to client connections.
     */
    @Bean(name = "hubDeliveryExecutor", destroyMethod = "shutdownNow")
    public ExecutorService hubDeliveryExecutor(@Value("${conversion.hub.delivery-threads:4}") int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable, "hub-delivery-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
