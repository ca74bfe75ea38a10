package com.delta.taskmonitor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class MonitorConfig {

    @Bean(name = "jobCheckExecutor", destroyMethod = "shutdown")
    public ExecutorService jobCheckExecutor(MonitorProperties properties) {
        return Executors.newFixedThreadPool(properties.getJobConcurrency(), runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("task-monitor-check");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean(name = "mailExecutor", destroyMethod = "shutdownNow")
    public ExecutorService mailExecutor() {
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("task-monitor-mail");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }
}
