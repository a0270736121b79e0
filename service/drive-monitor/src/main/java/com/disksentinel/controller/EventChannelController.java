package com.disksentinel.controller;

import com.disksentinel.service.ScanSupervisor;
import com.disksentinel.websocket.EventBus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/websocket")
@RequiredArgsConstructor
public class EventChannelController {

    private final EventBus eventBus;
    private final ScanSupervisor scanSupervisor;

    @GetMapping("/status")
    public ResponseEntity<?> getChannelStatus() {
        return ResponseEntity.ok(Map.of(
            "success", true,
            "data", Map.of(
                "subscribers", eventBus.subscriberCount(),
                "activeScans", scanSupervisor.activeScans().size()
            )
        ));
    }
}
