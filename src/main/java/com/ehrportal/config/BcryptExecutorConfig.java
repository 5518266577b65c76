package com.ehrportal.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Password hashing and verification run here, one worker per core, so a burst
 * of logins queues up instead of occupying every request thread.
 */
@Configuration
public class BcryptExecutorConfig {

    @Bean(name = "bcryptExecutor", destroyMethod = "shutdown")
    public ExecutorService bcryptExecutor() {
        int cores = Runtime.getRuntime().availableProcessors();
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(
            cores,
            r -> {
                Thread t = new Thread(r);
                t.setName("bcrypt-worker-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            }
        );
    }

}
