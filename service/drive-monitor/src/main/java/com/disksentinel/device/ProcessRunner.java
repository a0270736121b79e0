package com.disksentinel.device;

import java.time.Duration;
import java.util.List;

/**
 * 外部进程执行抽象，便于在测试中替换
 */
public interface ProcessRunner {

    /**
     * 执行命令并等待结束。
     *
     * @throws com.disksentinel.exception.ToolUnavailableException 可执行文件不存在或无法启动
     * @throws com.disksentinel.exception.ToolExecutionException 超时
     */
    ProcessResult run(List<String> command, Duration timeout);
}
