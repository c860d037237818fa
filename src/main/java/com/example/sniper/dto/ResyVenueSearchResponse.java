package com.example.sniper.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/** Body of {@code GET /3/venuesearch/search}. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ResyVenueSearchResponse {

    private Search search = new Search();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Search {
        private List<Hit> hits = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Hit {
        private ResyId id;
        private String name;
        private String neighborhood;
        private String locality;

        @JsonProperty("price_range_id")
        private Integer priceRange;

        private List<String> cuisine = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ResyId {
        private String resy;
    }

    public List<VenueDTO> toVenues() {
        if (search == null || search.getHits() == null) {
            return List.of();
        }
        return search.getHits().stream()
                .map(hit -> new VenueDTO(
                        hit.getId() != null ? hit.getId().getResy() : null,
                        hit.getName(),
                        hit.getNeighborhood(),
                        hit.getLocality(),
                        hit.getPriceRange(),
                        hit.getCuisine() != null ? new ArrayList<>(hit.getCuisine()) : new ArrayList<>()))
                .toList();
    }
}
