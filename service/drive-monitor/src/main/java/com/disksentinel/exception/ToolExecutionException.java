package com.disksentinel.exception;

/**
 * 外部工具非零退出或超时，携带原始 stderr
 */
public class ToolExecutionException extends DeviceException {

    private final String tool;
    private final int exitCode;
    private final String stderr;

    public ToolExecutionException(String device, String tool, int exitCode, String stderr) {
        super(device, tool + " exited with status " + exitCode);
        this.tool = tool;
        this.exitCode = exitCode;
        this.stderr = stderr == null ? "" : stderr;
    }

    public ToolExecutionException(String device, String tool, String message) {
        super(device, message);
        this.tool = tool;
        this.exitCode = -1;
        this.stderr = "";
    }

    public String getTool() {
        return tool;
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getStderr() {
        return stderr;
    }
}
