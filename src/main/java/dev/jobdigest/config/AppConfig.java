package dev.jobdigest.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Shared infrastructure beans: clock and the run worker executor.
 */
@Slf4j
@Configuration
@EnableScheduling
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ThreadPoolTaskExecutor runWorkerExecutor(QueueProperties queueProperties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(queueProperties.getWorkerThreads());
        executor.setMaxPoolSize(queueProperties.getWorkerThreads());
        executor.setThreadNamePrefix("run-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        log.info("Run worker executor started with {} threads", queueProperties.getWorkerThreads());
        return executor;
    }
}
