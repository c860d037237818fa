package com.example.sniper.service.exception;

public class InvalidWatchException extends RuntimeException {

    public InvalidWatchException(String message) {
        super(message);
    }
}
