package com.demo.altcredit.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/** Thread pools for collector fan-out, periodic background refresh and the idle-session sweep. */
@Configuration
@EnableScheduling
public class SchedulingConfig {

    @Bean(name = "refreshTaskScheduler")
    public ThreadPoolTaskScheduler refreshTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("altcredit-refresh-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean(name = "collectorExecutor")
    public ThreadPoolTaskExecutor collectorExecutor(CollectionProperties props) {
        int threads = Math.max(1, props.getCollector().getThreads());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("altcredit-collect-");
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
