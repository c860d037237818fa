package com.example.sniper.service;

import com.example.sniper.config.SniperConfig;
import com.example.sniper.controllers.BookingApiClient;
import com.example.sniper.dto.SlotOffer;
import com.example.sniper.model.ActivityType;
import com.example.sniper.model.FoundSlot;
import com.example.sniper.model.SniperSettings;
import com.example.sniper.model.Watch;
import com.example.sniper.repository.WatchRepository;
import com.example.sniper.service.exception.RemoteCallException;
import com.example.sniper.service.util.WatchRules;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class WatchScanner {

    private final WatchRepository watchRepository;
    private final BookingApiClient api;
    private final SlotLedger ledger;
    private final SnipeSequencer snipeSequencer;
    private final SettingsService settingsService;
    private final ActivityLog activity;
    private final SniperConfig config;

    /**
     * Scans every active watch. Does nothing while no API key is configured.
     * A failing watch is reported and the rest are still scanned.
     */
    public void scanAllActive() {
        SniperSettings settings = settingsService.current();
        if (!settings.hasApiKey()) {
            log.debug("No api_key configured, skipping scan");
            return;
        }

        List<Watch> watches = watchRepository.findAllByActiveTrue();
        log.debug("Scanning {} active watches", watches.size());

        for (Watch watch : watches) {
            try {
                scanWatch(watch, settings);
            } catch (Exception e) {
                log.error("Scan failed for watch {}: {}", watch.getId(), e.getMessage(), e);
                activity.append(watch.getId(), ActivityType.ERROR,
                        "Error checking %s: %s".formatted(watch.displayName(), e.getMessage()));
            }
        }
    }

    public void scanWatch(Watch watch, SniperSettings settings) {
        WatchRules.validate(watch);

        LocalDate end = watch.effectiveDateEnd();
        boolean first = true;
        for (LocalDate day = watch.getDateStart(); !day.isAfter(end); day = day.plusDays(1)) {
            if (!first) {
                pause(config.getDayPause());
            }
            first = false;

            List<SlotOffer> offers;
            try {
                offers = api.findSlots(watch.getVenueId(), day, watch.getPartySize());
            } catch (RemoteCallException e) {
                // transient per-day failures are not worth an activity entry
                log.debug("findSlots failed for watch {} on {}: {}", watch.getId(), day, e.getMessage());
                continue;
            }

            for (SlotOffer offer : offers) {
                processOffer(watch, day, offer, settings);
            }
        }

        watchRepository.updateLastChecked(watch.getId(), LocalDateTime.now());
    }

    private void processOffer(Watch watch, LocalDate day, SlotOffer offer, SniperSettings settings) {
        if (offer.start() == null || offer.start().isBlank()) {
            return;
        }
        if (!WatchRules.withinWindow(offer.timeOfDay(), watch.getTimeEarliest(), watch.getTimeLatest())) {
            return;
        }

        String time = offer.start();
        Optional<FoundSlot> known = ledger.findUnbooked(watch.getId(), day, time);
        if (known.isEmpty()) {
            boolean recorded = ledger.recordIfAbsent(FoundSlot.builder()
                    .watchId(watch.getId())
                    .venueName(watch.getVenueName())
                    .slotDate(day)
                    .slotTime(time)
                    .partySize(watch.getPartySize())
                    .configToken(offer.configToken())
                    .build());
            if (!recorded) {
                return;
            }
            activity.append(watch.getId(), ActivityType.FOUND,
                    "Slot found! %s - %s at %s for %d".formatted(
                            watch.displayName(), day, time, watch.getPartySize()));
        }

        if (watch.isSnipeMode() && offer.hasConfigToken() && settings.hasAuthToken()) {
            snipeIfClaimed(watch, day, time, offer.configToken());
        }
    }

    private void snipeIfClaimed(Watch watch, LocalDate day, String time, String configToken) {
        if (!ledger.claimSnipe(watch.getId(), day, time, config.getMaxSnipeAttempts())) {
            log.debug("Snipe not claimed for watch {} {} {}: in progress elsewhere or attempts used up",
                    watch.getId(), day, time);
            return;
        }
        try {
            snipeSequencer.snipe(watch, configToken, day, time);
        } finally {
            ledger.releaseSnipe(watch.getId(), day, time);
        }
    }

    private void pause(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
