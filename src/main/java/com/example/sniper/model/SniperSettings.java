package com.example.sniper.model;

/**
 * Snapshot of the credentials a scan needs. Blank values are normalised to null.
 *
 * @param apiKey          Resy API key; without it scans do nothing
 * @param authToken       user auth token; without it slots are recorded but never booked
 * @param paymentMethodId payment method sent with a booking; 0 when unset
 */
public record SniperSettings(String apiKey, String authToken, Long paymentMethodId) {

    public SniperSettings {
        apiKey = blankToNull(apiKey);
        authToken = blankToNull(authToken);
    }

    public static SniperSettings empty() {
        return new SniperSettings(null, null, null);
    }

    public boolean hasApiKey() {
        return apiKey != null;
    }

    public boolean hasAuthToken() {
        return authToken != null;
    }

    public long paymentMethodIdOrZero() {
        return paymentMethodId != null ? paymentMethodId : 0L;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
