package com.example.sniper.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;

/** Body of {@code GET /4/venue}. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ResyVenueResponse {

    private ResyVenueSearchResponse.ResyId id;
    private String name;
    private Location location;

    @JsonProperty("price_range")
    private Integer priceRange;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Location {
        private String neighborhood;
        private String locality;
    }

    public VenueDTO toVenue() {
        return new VenueDTO(
                id != null ? id.getResy() : null,
                name,
                location != null ? location.getNeighborhood() : null,
                location != null ? location.getLocality() : null,
                priceRange,
                new ArrayList<>());
    }
}
