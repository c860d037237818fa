package com.example.sniper.service;

public enum SnipeOutcome {
    BOOKED,
    DETAILS_FAILED,
    NO_TOKEN,
    BOOK_FAILED;

    public boolean booked() {
        return this == BOOKED;
    }
}
