package com.example.sniper.service;

import com.example.sniper.model.ActivityEvent;
import com.example.sniper.model.ActivityType;
import com.example.sniper.repository.ActivityEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Append-only record of what the monitor did. Each event is also written to the application log.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ActivityLog {

    private final ActivityEventRepository repository;

    public ActivityEvent append(Long watchId, ActivityType type, String message) {
        return append(watchId, type, message, null);
    }

    public ActivityEvent append(Long watchId, ActivityType type, String message, String details) {
        if (type == ActivityType.ERROR) {
            log.warn("[watch={}] {}", watchId, message);
        } else {
            log.info("[watch={}] {} {}", watchId, type, message);
        }
        return repository.save(ActivityEvent.builder()
                .watchId(watchId)
                .type(type)
                .message(truncate(message, 1024))
                .details(truncate(details, 4096))
                .createdAt(LocalDateTime.now())
                .build());
    }

    public List<ActivityEvent> recent() {
        return repository.findTop100ByOrderByCreatedAtDescIdDesc();
    }

    public void clear() {
        repository.deleteAllInBatch();
        log.info("Activity log cleared");
    }

    private String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
