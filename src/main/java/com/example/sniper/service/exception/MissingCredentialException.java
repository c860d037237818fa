package com.example.sniper.service.exception;

public class MissingCredentialException extends RuntimeException {

    public MissingCredentialException(String settingKey) {
        super("Setting '" + settingKey + "' is not configured");
    }
}
