package com.disksentinel.controller;

import com.disksentinel.model.ScanJobSnapshot;
import com.disksentinel.service.ScanSupervisor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/scan")
@RequiredArgsConstructor
public class ScanController {

    private final ScanSupervisor scanSupervisor;

    /**
     * 启动扫描，立即返回；进度只通过 /ws 推送
     */
    @PostMapping("/{drive}")
    public Map<String, Object> start(@PathVariable String drive) {
        log.info("Starting scan for {}...", drive);
        scanSupervisor.startScan(drive);
        return Map.of("status", "scan_started", "drive", drive);
    }

    @DeleteMapping("/{drive}")
    public Map<String, Object> cancel(@PathVariable String drive) {
        boolean signalled = scanSupervisor.cancelScan(drive);
        return Map.of("status", signalled ? "scan_cancel_requested" : "no_active_scan", "drive", drive);
    }

    @GetMapping("/{drive}")
    public ResponseEntity<ScanJobSnapshot> status(@PathVariable String drive) {
        return scanSupervisor.getStatus(drive)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping
    public List<ScanJobSnapshot> active() {
        return scanSupervisor.activeScans();
    }
}
