package com.example.sniper.controllers.impl;

import com.example.sniper.config.SniperConfig;
import com.example.sniper.dto.BookingConfirmation;
import com.example.sniper.dto.BookingDetails;
import com.example.sniper.dto.SlotOffer;
import com.example.sniper.dto.VenueDTO;
import com.example.sniper.model.SniperSettings;
import com.example.sniper.service.SettingsService;
import com.example.sniper.service.exception.MissingCredentialException;
import com.example.sniper.service.exception.RemoteCallException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@ExtendWith(MockitoExtension.class)
class ResyApiClientImplTest {

    private static final LocalDate JUNE_1 = LocalDate.of(2024, 6, 1);

    @Mock
    private SettingsService settingsService;

    private MockRestServiceServer server;
    private ResyApiClientImpl client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplateBuilder().rootUri("https://api.resy.com").build();
        server = MockRestServiceServer.bindTo(restTemplate).build();

        SniperConfig config = new SniperConfig();
        config.setLatitude("40.7128");
        config.setLongitude("-74.0060");
        client = new ResyApiClientImpl(restTemplate, settingsService, config);
    }

    @Test
    void shouldParseSlotsFromFindResponse() {
        given(settingsService.current()).willReturn(new SniperSettings("key123", "auth456", null));
        server.expect(requestTo(startsWith("https://api.resy.com/4/find")))
                .andExpect(method(HttpMethod.GET))
                .andExpect(queryParam("venue_id", "v1"))
                .andExpect(queryParam("day", "2024-06-01"))
                .andExpect(queryParam("party_size", "2"))
                .andExpect(header("Authorization", "ResyAPI api_key=\"key123\""))
                .andExpect(header("X-Resy-Auth-Token", "auth456"))
                .andRespond(withSuccess("""
                        {"results":{"venues":[{"venue":{"name":"Carbone"},"slots":[
                          {"date":{"start":"2024-06-01 19:00:00","end":"2024-06-01 21:00:00"},
                           "config":{"token":"tok1","type":"Dining Room"}},
                          {"date":{"start":"2024-06-01 21:30:00"},"config":{"token":"tok2"}}
                        ]}]}}
                        """, MediaType.APPLICATION_JSON));

        List<SlotOffer> offers = client.findSlots("v1", JUNE_1, 2);

        assertThat(offers).containsExactly(
                new SlotOffer("2024-06-01 19:00:00", "tok1", "Dining Room"),
                new SlotOffer("2024-06-01 21:30:00", "tok2", null));
        server.verify();
    }

    @Test
    void shouldReturnNoSlotsForEmptyResults() {
        given(settingsService.current()).willReturn(new SniperSettings("key123", null, null));
        server.expect(requestTo(startsWith("https://api.resy.com/4/find")))
                .andRespond(withSuccess("{\"results\":{\"venues\":[]}}", MediaType.APPLICATION_JSON));

        assertThat(client.findSlots("v1", JUNE_1, 2)).isEmpty();
    }

    @Test
    void shouldWrapHttpErrorsAsRemoteCallFailure() {
        given(settingsService.current()).willReturn(new SniperSettings("key123", null, null));
        server.expect(requestTo(startsWith("https://api.resy.com/4/find")))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThatThrownBy(() -> client.findSlots("v1", JUNE_1, 2))
                .isInstanceOf(RemoteCallException.class)
                .hasMessageContaining("503");
    }

    @Test
    void shouldRefuseToCallWithoutApiKey() {
        given(settingsService.current()).willReturn(SniperSettings.empty());

        assertThatThrownBy(() -> client.findSlots("v1", JUNE_1, 2))
                .isInstanceOf(MissingCredentialException.class);
    }

    @Test
    void shouldReadBookTokenFromDetails() {
        given(settingsService.current()).willReturn(new SniperSettings("key123", "auth456", null));
        server.expect(requestTo(startsWith("https://api.resy.com/3/details")))
                .andExpect(queryParam("config_id", "tok1"))
                .andRespond(withSuccess(
                        "{\"book_token\":{\"value\":\"bt1\",\"date_expires\":\"2024-06-01 18:05:00\"}}",
                        MediaType.APPLICATION_JSON));

        BookingDetails details = client.getBookingDetails("tok1", JUNE_1, 2);

        assertThat(details.requireBookToken()).isEqualTo("bt1");
        assertThat(details.expiresAt()).isEqualTo("2024-06-01 18:05:00");
    }

    @Test
    void shouldPostFormEncodedBooking() {
        given(settingsService.current()).willReturn(new SniperSettings("key123", "auth456", 777L));
        server.expect(requestTo("https://api.resy.com/3/book"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Content-Type", startsWith(MediaType.APPLICATION_FORM_URLENCODED_VALUE)))
                .andExpect(content().string(containsString("book_token=bt1")))
                .andExpect(content().string(containsString("struct_payment_method=%7B%22id%22%3A777%7D")))
                .andRespond(withSuccess("{\"resy_token\":\"rt\",\"reservation_id\":123}", MediaType.APPLICATION_JSON));

        BookingConfirmation confirmation = client.book("bt1");

        assertThat(confirmation.reservationId()).isEqualTo("123");
        assertThat(confirmation.resyToken()).isEqualTo("rt");
        server.verify();
    }

    @Test
    void shouldMapSearchHitsToVenues() {
        given(settingsService.current()).willReturn(new SniperSettings("key123", null, null));
        server.expect(requestTo(startsWith("https://api.resy.com/3/venuesearch/search")))
                .andRespond(withSuccess("""
                        {"search":{"hits":[{"id":{"resy":1505},"name":"Don Angie",
                          "neighborhood":"West Village","locality":"New York","cuisine":["Italian"]}]}}
                        """, MediaType.APPLICATION_JSON));

        List<VenueDTO> venues = client.search("don angie");

        assertThat(venues).singleElement().satisfies(venue -> {
            assertThat(venue.getId()).isEqualTo("1505");
            assertThat(venue.getName()).isEqualTo("Don Angie");
            assertThat(venue.getCuisine()).containsExactly("Italian");
        });
    }
}
