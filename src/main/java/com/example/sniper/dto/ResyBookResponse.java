package com.example.sniper.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ResyBookResponse {

    @JsonProperty("resy_token")
    private String resyToken;

    @JsonProperty("reservation_id")
    private String reservationId;

    public BookingConfirmation toConfirmation() {
        return new BookingConfirmation(reservationId, resyToken);
    }
}
