package com.example.sniper.dto;

public record BookingConfirmation(String reservationId, String resyToken) {
}
