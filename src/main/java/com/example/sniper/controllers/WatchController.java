package com.example.sniper.controllers;

import com.example.sniper.dto.WatchRequest;
import com.example.sniper.model.FoundSlot;
import com.example.sniper.model.Watch;
import com.example.sniper.service.SlotLedger;
import com.example.sniper.service.WatchService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class WatchController {

    private final WatchService watchService;
    private final SlotLedger ledger;

    @GetMapping("/watches")
    public List<Watch> list() {
        return watchService.findAll();
    }

    @PostMapping("/watches")
    public ResponseEntity<Map<String, Object>> create(@Valid @RequestBody WatchRequest request) {
        Watch watch = watchService.create(request);
        return ResponseEntity.ok(Map.of("ok", true, "id", watch.getId()));
    }

    @PutMapping("/watches/{id}")
    public ResponseEntity<Map<String, Object>> update(@PathVariable Long id, @Valid @RequestBody WatchRequest request) {
        watchService.update(id, request);
        return ResponseEntity.ok(Map.of("ok", true));
    }

    @DeleteMapping("/watches/{id}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable Long id) {
        watchService.delete(id);
        return ResponseEntity.ok(Map.of("ok", true));
    }

    /** Most recent slot sightings, newest first */
    @GetMapping("/found")
    public List<FoundSlot> found() {
        return ledger.recent();
    }
}
