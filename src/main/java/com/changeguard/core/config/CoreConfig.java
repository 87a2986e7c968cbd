package com.changeguard.core.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class CoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Runs code-generation calls so they can be bounded by a timeout. */
    @Bean(name = "generationExecutor", destroyMethod = "shutdownNow")
    public ExecutorService generationExecutor() {
        var counter = new AtomicInteger();
        return Executors.newFixedThreadPool(2, r -> {
            var thread = new Thread(r, "codegen-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
