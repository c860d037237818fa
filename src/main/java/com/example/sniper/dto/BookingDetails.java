package com.example.sniper.dto;

import com.example.sniper.service.exception.MissingTokenException;

public record BookingDetails(String bookToken, String expiresAt) {

    public String requireBookToken() {
        if (bookToken == null || bookToken.isBlank()) {
            throw new MissingTokenException();
        }
        return bookToken;
    }
}
