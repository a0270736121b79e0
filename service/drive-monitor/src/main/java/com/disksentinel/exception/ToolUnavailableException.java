package com.disksentinel.exception;

/**
 * 外部工具不存在或无法执行
 */
public class ToolUnavailableException extends DeviceException {

    private final String tool;

    public ToolUnavailableException(String tool, Throwable cause) {
        super(null, "External tool unavailable: " + tool, cause);
        this.tool = tool;
    }

    public String getTool() {
        return tool;
    }
}
