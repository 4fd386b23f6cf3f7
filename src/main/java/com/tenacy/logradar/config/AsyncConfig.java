package com.tenacy.logradar.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.RejectedExecutionHandler;

@Slf4j
@Configuration
@EnableAsync
public class AsyncConfig {

    @Value("${logradar.async.detection-pool-size:4}")
    private int detectionPoolSize;

    @Value("${logradar.async.training-pool-size:2}")
    private int trainingPoolSize;

    @Value("${logradar.async.shutdown-await-seconds:10}")
    private int shutdownAwaitSeconds;

    /**
     * 알림 발송용 풀. 큐가 가득 차면 탐지 루프를 막지 않도록 작업을 버린다.
     */
    @Bean(name = "notificationTaskExecutor")
    public ThreadPoolTaskExecutor notificationTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(5);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("notify-");
        executor.setRejectedExecutionHandler(dropAndLog("notification"));
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(shutdownAwaitSeconds);
        executor.initialize();
        return executor;
    }

    @Bean(name = "explanationTaskExecutor")
    public ThreadPoolTaskExecutor explanationTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(3);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("explain-");
        executor.setRejectedExecutionHandler(dropAndLog("explanation"));
        executor.initialize();
        return executor;
    }

    /**
     * 서비스별 탐지 파이프라인을 병렬로 돌리는 풀.
     */
    @Bean(name = "detectionExecutor")
    public ThreadPoolTaskExecutor detectionExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(detectionPoolSize);
        executor.setMaxPoolSize(detectionPoolSize);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("detect-");
        executor.setRejectedExecutionHandler(dropAndLog("detection"));
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(shutdownAwaitSeconds);
        executor.initialize();
        return executor;
    }

    /**
     * 포레스트 재학습 전용 풀. 스코어링 경로와 분리된다.
     */
    @Bean(name = "modelTrainingExecutor")
    public ThreadPoolTaskExecutor modelTrainingExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(trainingPoolSize);
        executor.setMaxPoolSize(trainingPoolSize);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("train-");
        executor.setRejectedExecutionHandler(dropAndLog("model training"));
        executor.initialize();
        return executor;
    }

    private RejectedExecutionHandler dropAndLog(String poolName) {
        return (task, pool) -> log.warn("{} executor saturated (active={}, queued={}), dropping task",
                poolName, pool.getActiveCount(), pool.getQueue().size());
    }
}
