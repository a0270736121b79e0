package com.disksentinel.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class TaskExecutorConfig {

    // 每个扫描独占一个线程，不排队：队列容量为 0 时线程直接增长到上限，超出即拒绝（HTTP 503），
    // 不能回落到请求线程，也不能排在别的设备后面等待
    @Bean("scanExecutor")
    public ThreadPoolTaskExecutor scanExecutor(ApplicationConfig config) {
        int max = Math.max(1, config.getPerformance().getMaxConcurrentScans());
        ThreadPoolTaskExecutor exec = new ThreadPoolTaskExecutor();
        exec.setCorePoolSize(max);
        exec.setMaxPoolSize(max);
        exec.setQueueCapacity(0);
        exec.setAllowCoreThreadTimeOut(true);
        exec.setThreadNamePrefix("scan-");
        exec.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        exec.setWaitForTasksToCompleteOnShutdown(false);
        exec.initialize();
        return exec;
    }

    @Bean("deliveryExecutor")
    public ThreadPoolTaskExecutor deliveryExecutor(ApplicationConfig config) {
        ThreadPoolTaskExecutor exec = new ThreadPoolTaskExecutor();
        exec.setCorePoolSize(Math.min(8, Math.max(1, config.getPerformance().getDeliveryCoreSize())));
        exec.setMaxPoolSize(Math.max(exec.getCorePoolSize(), config.getPerformance().getDeliveryMaxSize()));
        exec.setQueueCapacity(config.getPerformance().getDeliveryQueueCapacity());
        exec.setThreadNamePrefix("ws-delivery-");
        exec.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        exec.initialize();
        return exec;
    }

    /**
     * 单个扫描任务专用的读线程。卡住的读只占用本任务的线程，不影响其他设备。
     * 由扫描引擎在扫描开始时创建、结束时关闭。
     */
    public static ThreadPoolTaskExecutor jobReadExecutor(String device) {
        ThreadPoolTaskExecutor exec = new ThreadPoolTaskExecutor();
        exec.setCorePoolSize(1);
        exec.setMaxPoolSize(1);
        exec.setThreadNamePrefix("read-" + device + "-");
        exec.setDaemon(true);
        exec.setWaitForTasksToCompleteOnShutdown(false);
        exec.initialize();
        return exec;
    }
}
