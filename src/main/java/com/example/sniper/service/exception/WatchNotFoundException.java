package com.example.sniper.service.exception;

public class WatchNotFoundException extends RuntimeException {

    public WatchNotFoundException(Long id) {
        super("Watch " + id + " not found");
    }
}
