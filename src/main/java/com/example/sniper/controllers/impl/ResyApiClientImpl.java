package com.example.sniper.controllers.impl;

import com.example.sniper.config.SniperConfig;
import com.example.sniper.controllers.BookingApiClient;
import com.example.sniper.dto.BookingConfirmation;
import com.example.sniper.dto.BookingDetails;
import com.example.sniper.dto.ResyBookResponse;
import com.example.sniper.dto.ResyDetailsResponse;
import com.example.sniper.dto.ResyFindResponse;
import com.example.sniper.dto.ResyVenueResponse;
import com.example.sniper.dto.ResyVenueSearchResponse;
import com.example.sniper.dto.SlotOffer;
import com.example.sniper.dto.VenueDTO;
import com.example.sniper.model.Setting;
import com.example.sniper.model.SniperSettings;
import com.example.sniper.service.SettingsService;
import com.example.sniper.service.exception.MissingCredentialException;
import com.example.sniper.service.exception.RemoteCallException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class ResyApiClientImpl implements BookingApiClient {

    private static final String USER_AGENT =
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36";
    private static final String ORIGIN = "https://resy.com";

    private final RestTemplate resyRestTemplate;
    private final SettingsService settingsService;
    private final SniperConfig config;

    @Override
    public List<VenueDTO> search(String query) {
        String geo = "{\"latitude\":" + config.getLatitude() + ",\"longitude\":" + config.getLongitude() + "}";
        ResyVenueSearchResponse body = get(
                "/3/venuesearch/search?query={query}&geo={geo}&types={types}&per_page=10",
                ResyVenueSearchResponse.class,
                Map.of("query", query, "geo", geo, "types", "[\"venue\"]"));
        return body != null ? body.toVenues() : List.of();
    }

    @Override
    public VenueDTO getVenue(String venueId) {
        ResyVenueResponse body = get("/4/venue?id={id}", ResyVenueResponse.class, Map.of("id", venueId));
        if (body == null) {
            throw new RemoteCallException("Empty venue response for " + venueId);
        }
        return body.toVenue();
    }

    @Override
    public List<SlotOffer> findSlots(String venueId, LocalDate day, int partySize) {
        ResyFindResponse body = get(
                "/4/find?venue_id={venueId}&day={day}&party_size={partySize}&lat={lat}&long={lng}",
                ResyFindResponse.class,
                Map.of("venueId", venueId,
                        "day", day.toString(),
                        "partySize", partySize,
                        "lat", config.getLatitude(),
                        "lng", config.getLongitude()));
        List<SlotOffer> offers = body != null ? body.toOffers() : List.of();
        log.debug("Venue {} on {} for {}: {} slots", venueId, day, partySize, offers.size());
        return offers;
    }

    @Override
    public BookingDetails getBookingDetails(String configToken, LocalDate day, int partySize) {
        ResyDetailsResponse body = get(
                "/3/details?config_id={configId}&day={day}&party_size={partySize}",
                ResyDetailsResponse.class,
                Map.of("configId", configToken, "day", day.toString(), "partySize", partySize));
        return body != null ? body.toDetails() : new BookingDetails(null, null);
    }

    @Override
    public BookingConfirmation book(String bookToken) {
        SniperSettings settings = settingsService.current();

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("book_token", bookToken);
        form.add("struct_payment_method", "{\"id\":" + settings.paymentMethodIdOrZero() + "}");

        HttpHeaders headers = headers(settings);
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        try {
            ResponseEntity<ResyBookResponse> response = resyRestTemplate.exchange(
                    "/3/book", HttpMethod.POST, new HttpEntity<>(form, headers), ResyBookResponse.class);
            ResyBookResponse body = response.getBody();
            return body != null ? body.toConfirmation() : new BookingConfirmation(null, null);
        } catch (HttpStatusCodeException e) {
            log.warn("Booking rejected: {} : {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new RemoteCallException("HTTP " + e.getStatusCode().value() + " from /3/book", e);
        } catch (RestClientException e) {
            log.warn("Booking call failed: {}", e.getMessage());
            throw new RemoteCallException(e.getMessage(), e);
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private <T> T get(String uriTemplate, Class<T> type, Map<String, ?> uriVariables) {
        HttpHeaders headers = headers(settingsService.current());
        try {
            ResponseEntity<T> response = resyRestTemplate.exchange(
                    uriTemplate, HttpMethod.GET, new HttpEntity<>(headers), type, uriVariables);
            return response.getBody();
        } catch (HttpStatusCodeException e) {
            log.debug("GET {} returned {}", uriTemplate, e.getStatusCode());
            throw new RemoteCallException("HTTP " + e.getStatusCode().value() + " from " + path(uriTemplate), e);
        } catch (RestClientException e) {
            log.debug("GET {} failed: {}", uriTemplate, e.getMessage());
            throw new RemoteCallException(e.getMessage(), e);
        }
    }

    private HttpHeaders headers(SniperSettings settings) {
        if (!settings.hasApiKey()) {
            throw new MissingCredentialException(Setting.API_KEY);
        }
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, "ResyAPI api_key=\"" + settings.apiKey() + "\"");
        headers.set(HttpHeaders.USER_AGENT, USER_AGENT);
        headers.set(HttpHeaders.ORIGIN, ORIGIN);
        headers.set(HttpHeaders.REFERER, ORIGIN + "/");
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (settings.hasAuthToken()) {
            headers.set("X-Resy-Auth-Token", settings.authToken());
        }
        return headers;
    }

    private String path(String uriTemplate) {
        int query = uriTemplate.indexOf('?');
        return query >= 0 ? uriTemplate.substring(0, query) : uriTemplate;
    }
}
