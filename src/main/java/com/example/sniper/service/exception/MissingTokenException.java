package com.example.sniper.service.exception;

public class MissingTokenException extends RuntimeException {

    public MissingTokenException() {
        super("No book token received");
    }
}
