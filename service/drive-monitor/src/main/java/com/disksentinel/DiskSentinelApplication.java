package com.disksentinel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Disk Sentinel 应用主类
 *
 * 功能特性：
 * - 磁盘枚举与 SMART 遥测（外部工具调用）
 * - 后台表面扫描，进度经 /ws 推送给所有订阅端
 * - 扫描与请求处理线程池隔离，单个扫描不阻塞接口
 */
@SpringBootApplication(scanBasePackages = "com.disksentinel")
public class DiskSentinelApplication {

    public static void main(String[] args) {
        SpringApplication.run(DiskSentinelApplication.class, args);
    }
}
