package com.disksentinel.config;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;

/**
 * 应用配置类 - 集中管理配置参数
 *
 * 配置分层策略：
 * 1. application.yml: 外部工具路径、扫描参数、推送通道参数
 * 2. ApplicationConfig: 默认值、工具方法
 * 3. Service类: 在构造时缓存常用配置值
 */
@Slf4j
@Data
@Configuration
@ConfigurationProperties(prefix = "app")
public class ApplicationConfig {

    // ========== 核心业务配置（从yml读取） ==========
    private Tools tools = new Tools();
    private Scan scan = new Scan();
    private Websocket websocket = new Websocket();
    private Erase erase = new Erase();
    private Benchmark benchmark = new Benchmark();

    // ========== 技术参数配置（类内默认值） ==========
    private Performance performance = new Performance();

    @Data
    public static class Tools {
        private String lsblkPath = "lsblk";
        private String smartctlPath = "smartctl";
        private String hdparmPath = "hdparm";
        private String deviceDir = "/dev";
        private String sysBlockDir = "/sys/class/block";
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Scan {
        private int chunkSize = 512;
        private Duration readTimeout = Duration.ofSeconds(5);
        private Duration chunkPause = Duration.ZERO;
        // 连续超时达到该次数视为设备无响应
        private int maxConsecutiveTimeouts = 3;
        private Duration statusRetention = Duration.ofMinutes(5);
    }

    @Data
    public static class Websocket {
        private String path = "/ws";
        private Duration pingInterval = Duration.ofSeconds(10);
        private Duration pongTimeout = Duration.ofSeconds(30);
        private int subscriberQueueCapacity = 256;
        private Duration sendTimeLimit = Duration.ofSeconds(5);
        private int sendBufferSizeLimit = 512 * 1024;
    }

    @Data
    public static class Erase {
        private boolean enabled = false;
        private String password = "password";
    }

    @Data
    public static class Benchmark {
        private int sampleSize = 1024 * 1024;
    }

    @Data
    public static class Performance {
        // 同时运行的扫描上限，超出直接拒绝（无排队）
        private int maxConcurrentScans = 8;
        private int deliveryCoreSize = 2;
        private int deliveryMaxSize = 8;
        private int deliveryQueueCapacity = 10000;
        private int schedulePoolSize = 2;
    }

    // ========== 便捷方法 ==========

    /**
     * 设备文件路径，如 /dev/sda
     */
    public Path devicePath(String device) {
        return Path.of(tools.getDeviceDir(), device);
    }

    public String deviceArgument(String device) {
        return devicePath(device).toString();
    }

    public int getChunkSize() {
        return Math.max(1, scan.getChunkSize());
    }

    public Duration getPingInterval() {
        return websocket.getPingInterval();
    }

    public Duration getPongTimeout() {
        return websocket.getPongTimeout();
    }
}
