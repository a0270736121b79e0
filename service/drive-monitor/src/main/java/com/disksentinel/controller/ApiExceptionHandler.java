package com.disksentinel.controller;

import com.disksentinel.exception.DeviceAccessDeniedException;
import com.disksentinel.exception.DeviceUnavailableException;
import com.disksentinel.exception.EraseDisabledException;
import com.disksentinel.exception.ScanAlreadyRunningException;
import com.disksentinel.exception.ToolExecutionException;
import com.disksentinel.exception.ToolUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 将设备异常映射为结构化错误响应：{"success":false,"error":...,"message":...}
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ToolUnavailableException.class)
    public ResponseEntity<Map<String, Object>> toolUnavailable(ToolUnavailableException e) {
        log.error("External tool unavailable: {}", e.getTool());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "tool_unavailable", e.getMessage());
    }

    @ExceptionHandler(ToolExecutionException.class)
    public ResponseEntity<Map<String, Object>> toolExecution(ToolExecutionException e) {
        log.error("{} failed for {}: {}", e.getTool(), e.getDevice(), e.getStderr().trim());
        ResponseEntity<Map<String, Object>> resp = error(HttpStatus.BAD_GATEWAY, "tool_execution_error", e.getMessage());
        resp.getBody().put("stderr", e.getStderr());
        return resp;
    }

    @ExceptionHandler(DeviceAccessDeniedException.class)
    public ResponseEntity<Map<String, Object>> accessDenied(DeviceAccessDeniedException e) {
        log.warn("Access denied for {}: {}", e.getDevice(), e.getMessage());
        return error(HttpStatus.FORBIDDEN, "device_access_denied", e.getMessage());
    }

    @ExceptionHandler(DeviceUnavailableException.class)
    public ResponseEntity<Map<String, Object>> unavailable(DeviceUnavailableException e) {
        log.warn("Device unavailable {}: {}", e.getDevice(), e.getMessage());
        return error(HttpStatus.NOT_FOUND, "device_unavailable", e.getMessage());
    }

    @ExceptionHandler(ScanAlreadyRunningException.class)
    public ResponseEntity<Map<String, Object>> alreadyRunning(ScanAlreadyRunningException e) {
        return error(HttpStatus.CONFLICT, "scan_already_running", e.getMessage());
    }

    @ExceptionHandler(EraseDisabledException.class)
    public ResponseEntity<Map<String, Object>> eraseDisabled(EraseDisabledException e) {
        log.warn("Rejected secure erase of {}: disabled", e.getDevice());
        return error(HttpStatus.FORBIDDEN, "erase_disabled", e.getMessage());
    }

    @ExceptionHandler(TaskRejectedException.class)
    public ResponseEntity<Map<String, Object>> rejected(TaskRejectedException e) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, "scan_capacity_exhausted", "Too many scans queued");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", e.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String kind, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", kind);
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
