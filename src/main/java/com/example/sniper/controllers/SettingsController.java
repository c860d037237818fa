package com.example.sniper.controllers;

import com.example.sniper.service.SettingsService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequiredArgsConstructor
public class SettingsController {

    private final SettingsService settingsService;

    /** Saved settings; api_key and auth_token come back shortened. */
    @GetMapping("/api/settings")
    public Map<String, String> get() {
        return settingsService.masked();
    }

    @PostMapping("/api/settings")
    public ResponseEntity<Map<String, Object>> save(@RequestBody Map<String, String> values) {
        settingsService.saveAll(values);
        return ResponseEntity.ok(Map.of("ok", true));
    }
}
