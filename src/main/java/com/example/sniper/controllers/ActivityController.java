package com.example.sniper.controllers;

import com.example.sniper.model.ActivityEvent;
import com.example.sniper.service.ActivityLog;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class ActivityController {

    private final ActivityLog activity;

    @GetMapping("/api/activity")
    public List<ActivityEvent> recent() {
        return activity.recent();
    }

    @DeleteMapping("/api/activity")
    public ResponseEntity<Map<String, Object>> clear() {
        activity.clear();
        return ResponseEntity.ok(Map.of("ok", true));
    }
}
