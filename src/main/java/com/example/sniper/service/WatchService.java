package com.example.sniper.service;

import com.example.sniper.dto.WatchRequest;
import com.example.sniper.model.ActivityType;
import com.example.sniper.model.Watch;
import com.example.sniper.repository.WatchRepository;
import com.example.sniper.service.exception.WatchNotFoundException;
import com.example.sniper.service.util.WatchRules;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class WatchService {

    private final WatchRepository repository;
    private final ActivityLog activity;

    public List<Watch> findAll() {
        return repository.findAllByOrderByCreatedAtDesc();
    }

    @Transactional
    public Watch create(WatchRequest request) {
        Watch watch = Watch.builder()
                .venueId(request.getVenueId())
                .dateStart(request.getDateStart())
                .dateEnd(request.getDateEnd())
                .build();
        if (request.getVenueName() != null) watch.setVenueName(request.getVenueName());
        if (request.getPartySize() != null) watch.setPartySize(request.getPartySize());
        if (request.getTimeEarliest() != null) watch.setTimeEarliest(request.getTimeEarliest());
        if (request.getTimeLatest() != null) watch.setTimeLatest(request.getTimeLatest());
        if (request.getSnipeMode() != null) watch.setSnipeMode(request.getSnipeMode());
        if (request.getActive() != null) watch.setActive(request.getActive());

        WatchRules.validate(watch);
        Watch saved = repository.save(watch);
        activity.append(saved.getId(), ActivityType.WATCH, "Added watch: " + saved.displayName());
        return saved;
    }

    @Transactional
    public Watch update(Long id, WatchRequest request) {
        Watch watch = repository.findById(id).orElseThrow(() -> new WatchNotFoundException(id));

        if (request.getActive() != null) watch.setActive(request.getActive());
        if (request.getSnipeMode() != null) watch.setSnipeMode(request.getSnipeMode());
        if (request.getPartySize() != null) watch.setPartySize(request.getPartySize());
        if (request.getDateStart() != null) watch.setDateStart(request.getDateStart());
        if (request.providesDateEnd()) watch.setDateEnd(request.getDateEnd());
        if (request.providesTimeEarliest()) watch.setTimeEarliest(request.getTimeEarliest());
        if (request.providesTimeLatest()) watch.setTimeLatest(request.getTimeLatest());

        WatchRules.validate(watch);
        log.info("Watch {} updated", id);
        return repository.save(watch);
    }

    @Transactional
    public void delete(Long id) {
        if (!repository.existsById(id)) {
            throw new WatchNotFoundException(id);
        }
        repository.deleteById(id);
        log.info("Watch {} deleted", id);
    }
}
