package com.example.sniper.config;

import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Static configuration read from {@code application.properties}.
 * Credentials configured here are only fallbacks; values saved through
 * {@code /api/settings} win.
 */
@Configuration
@Data
public class SniperConfig {

    @Value("${sniper.api.base-url:https://api.resy.com}")
    String apiBaseUrl;

    @Value("${sniper.api.connect-timeout:5s}")
    Duration connectTimeout;

    @Value("${sniper.api.read-timeout:15s}")
    Duration readTimeout;

    @Value("${sniper.api.latitude:40.7128}")
    String latitude;

    @Value("${sniper.api.longitude:-74.0060}")
    String longitude;

    @Value("${sniper.api.key:}")
    String apiKey;

    @Value("${sniper.api.auth-token:}")
    String authToken;

    @Value("${sniper.api.payment-method-id:}")
    String paymentMethodId;

    @Value("${sniper.monitor.interval:30s}")
    Duration monitorInterval;

    @Value("${sniper.monitor.auto-start:false}")
    boolean autoStart;

    /** pause between two day requests of the same watch */
    @Value("${sniper.scan.day-pause:1s}")
    Duration dayPause;

    @Value("${sniper.snipe.max-attempts:3}")
    int maxSnipeAttempts;
}
