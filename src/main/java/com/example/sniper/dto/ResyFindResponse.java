package com.example.sniper.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/** Body of {@code GET /4/find}; only the parts the scanner reads. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ResyFindResponse {

    private Results results = new Results();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Results {
        private List<VenueSlots> venues = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class VenueSlots {
        private List<Slot> slots = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Slot {
        private SlotDate date;
        private SlotConfig config;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SlotDate {
        private String start;
        private String end;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SlotConfig {
        private String token;
        private String type;
    }

    public List<SlotOffer> toOffers() {
        List<SlotOffer> offers = new ArrayList<>();
        if (results == null || results.getVenues() == null) {
            return offers;
        }
        for (VenueSlots venue : results.getVenues()) {
            if (venue == null || venue.getSlots() == null) continue;
            for (Slot slot : venue.getSlots()) {
                if (slot == null) continue;
                String start = slot.getDate() != null ? slot.getDate().getStart() : null;
                String token = slot.getConfig() != null ? slot.getConfig().getToken() : null;
                String type = slot.getConfig() != null ? slot.getConfig().getType() : null;
                offers.add(new SlotOffer(start, token, type));
            }
        }
        return offers;
    }
}
