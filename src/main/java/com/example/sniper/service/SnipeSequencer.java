package com.example.sniper.service;

import com.example.sniper.controllers.BookingApiClient;
import com.example.sniper.dto.BookingConfirmation;
import com.example.sniper.dto.BookingDetails;
import com.example.sniper.model.ActivityType;
import com.example.sniper.model.Watch;
import com.example.sniper.service.exception.MissingTokenException;
import com.example.sniper.service.exception.RemoteCallException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;

/**
 * Books a slot in two calls: booking details (yields a book token), then the booking itself.
 * A failed attempt is reported and left alone; the next scan decides whether to try again.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SnipeSequencer {

    private final BookingApiClient api;
    private final SlotLedger ledger;
    private final ActivityLog activity;

    public SnipeOutcome snipe(Watch watch, String configToken, LocalDate day, String time) {
        Long watchId = watch.getId();
        activity.append(watchId, ActivityType.SNIPE,
                "Attempting to snipe %s %s %s...".formatted(watch.displayName(), day, time));

        BookingDetails details;
        try {
            details = api.getBookingDetails(configToken, day, watch.getPartySize());
        } catch (RemoteCallException e) {
            activity.append(watchId, ActivityType.ERROR, "Failed to get details: " + e.getMessage());
            return SnipeOutcome.DETAILS_FAILED;
        }

        String bookToken;
        try {
            bookToken = details.requireBookToken();
        } catch (MissingTokenException e) {
            activity.append(watchId, ActivityType.ERROR, e.getMessage());
            return SnipeOutcome.NO_TOKEN;
        }

        BookingConfirmation confirmation;
        try {
            confirmation = api.book(bookToken);
        } catch (RemoteCallException e) {
            activity.append(watchId, ActivityType.ERROR, "Booking failed: " + e.getMessage());
            return SnipeOutcome.BOOK_FAILED;
        }

        String reservation = confirmation.reservationId() != null
                ? "reservation_id=" + confirmation.reservationId()
                : null;
        activity.append(watchId, ActivityType.BOOKED,
                "BOOKED! %s %s at %s".formatted(watch.displayName(), day, time), reservation);
        int updated = ledger.markBooked(watchId, day, time);
        log.info("Booked watch={} {} {} (slots marked: {})", watchId, day, time, updated);
        return SnipeOutcome.BOOKED;
    }
}
