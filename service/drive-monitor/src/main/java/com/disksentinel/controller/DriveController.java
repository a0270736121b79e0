package com.disksentinel.controller;

import com.disksentinel.config.ApplicationConfig;
import com.disksentinel.exception.EraseDisabledException;
import com.disksentinel.exception.ScanAlreadyRunningException;
import com.disksentinel.model.BenchmarkResult;
import com.disksentinel.model.Device;
import com.disksentinel.model.EraseConfirmation;
import com.disksentinel.model.SmartAttribute;
import com.disksentinel.service.BenchmarkService;
import com.disksentinel.service.DeviceGateway;
import com.disksentinel.service.ScanSupervisor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
public class DriveController {

    private final DeviceGateway deviceGateway;
    private final BenchmarkService benchmarkService;
    private final ScanSupervisor scanSupervisor;
    private final ApplicationConfig config;

    @GetMapping("/drives")
    public Map<String, Object> listDrives() {
        log.info("Fetching available physical drives...");
        List<String> names = deviceGateway.listDevices().stream().map(Device::getName).toList();
        return Map.of("drives", names);
    }

    @GetMapping("/smart/{drive}")
    public Map<String, Object> smart(@PathVariable String drive) {
        log.info("Fetching SMART data for {}", drive);
        Map<String, SmartAttribute> attributes = deviceGateway.fetchSmartAttributes(drive);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("drive", drive);
        body.put("smart_data", attributes);
        return body;
    }

    @GetMapping("/benchmark/{drive}")
    public BenchmarkResult benchmark(@PathVariable String drive) {
        log.info("Benchmarking {}", drive);
        return benchmarkService.benchmark(drive);
    }

    /**
     * 安全擦除，需显式开启 app.erase.enabled
     */
    @PostMapping("/erase/{drive}")
    public EraseConfirmation erase(@PathVariable String drive) {
        if (!config.getErase().isEnabled()) {
            throw new EraseDisabledException(drive);
        }
        if (scanSupervisor.isActive(drive)) {
            throw new ScanAlreadyRunningException(drive);
        }
        return deviceGateway.secureErase(drive);
    }
}
