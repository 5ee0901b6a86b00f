package com.example.ecotravel.planner.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ExecutorConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService externalCallExecutor(PlannerToolsProperties props) {
        CustomizableThreadFactory threads = new CustomizableThreadFactory("planner-ext-");
        threads.setDaemon(true);
        return Executors.newFixedThreadPool(props.getExecutorThreads(), threads);
    }
}
