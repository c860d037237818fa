package com.example.sniper.controllers;

import com.example.sniper.model.MonitorState;
import com.example.sniper.service.MonitorLoop;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
public class MonitorController {

    private final MonitorLoop monitor;

    @GetMapping("/api/monitor/status")
    public Map<String, Object> status() {
        return body(monitor.status());
    }

    @PostMapping("/api/monitor/start")
    public Map<String, Object> start() {
        if (!monitor.start()) {
            log.debug("Start requested while already running");
        }
        return body(monitor.status());
    }

    @PostMapping("/api/monitor/stop")
    public Map<String, Object> stop() {
        monitor.stop();
        return body(monitor.status());
    }

    /** One-off scan of all active watches, independent of the periodic cycle. */
    @PostMapping("/api/check")
    public ResponseEntity<Map<String, Object>> check() {
        monitor.triggerImmediateScan();
        return ResponseEntity.accepted().body(Map.of("ok", true, "message", "Check triggered"));
    }

    private Map<String, Object> body(MonitorState state) {
        return Map.of("running", state == MonitorState.RUNNING, "state", state.name());
    }
}
