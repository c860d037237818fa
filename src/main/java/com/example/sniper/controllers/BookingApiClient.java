package com.example.sniper.controllers;

import com.example.sniper.dto.BookingConfirmation;
import com.example.sniper.dto.BookingDetails;
import com.example.sniper.dto.SlotOffer;
import com.example.sniper.dto.VenueDTO;

import java.time.LocalDate;
import java.util.List;

/**
 * Remote booking platform. Every method either returns a result or throws
 * {@link com.example.sniper.service.exception.RemoteCallException}.
 */
public interface BookingApiClient {

    /** Venues matching a free-text query */
    List<VenueDTO> search(String query);

    VenueDTO getVenue(String venueId);

    /** Open slots for a venue on one day, in the platform's order */
    List<SlotOffer> findSlots(String venueId, LocalDate day, int partySize);

    /** Exchange a slot's config token for a book token */
    BookingDetails getBookingDetails(String configToken, LocalDate day, int partySize);

    BookingConfirmation book(String bookToken);
}
