package com.example.sniper.controllers;

import com.example.sniper.dto.VenueDTO;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequiredArgsConstructor
public class VenueController {

    private final BookingApiClient api;

    @GetMapping("/api/search")
    public ResponseEntity<?> search(@RequestParam(name = "q", required = false) String query) {
        if (query == null || query.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Missing query"));
        }
        return ResponseEntity.ok(api.search(query));
    }

    @GetMapping("/api/venue/{venueId}")
    public VenueDTO venue(@PathVariable String venueId) {
        return api.getVenue(venueId);
    }
}
