package com.example.sniper.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ResyDetailsResponse {

    @JsonProperty("book_token")
    private BookToken bookToken;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BookToken {
        private String value;

        @JsonProperty("date_expires")
        private String dateExpires;
    }

    public BookingDetails toDetails() {
        if (bookToken == null) {
            return new BookingDetails(null, null);
        }
        return new BookingDetails(bookToken.getValue(), bookToken.getDateExpires());
    }
}
