package com.example.sniper.service;

import com.example.sniper.config.SniperConfig;
import com.example.sniper.model.Setting;
import com.example.sniper.model.SniperSettings;
import com.example.sniper.repository.SettingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class SettingsService {

    private static final Set<String> SECRET_KEYS = Set.of(Setting.API_KEY, Setting.AUTH_TOKEN);

    private final SettingRepository repository;
    private final SniperConfig config;

    /** Stored settings, falling back to {@code sniper.api.*} properties for anything not saved. */
    public SniperSettings current() {
        Map<String, String> stored = storedValues();
        return new SniperSettings(
                valueOrDefault(stored, Setting.API_KEY, config.getApiKey()),
                valueOrDefault(stored, Setting.AUTH_TOKEN, config.getAuthToken()),
                parsePaymentMethod(valueOrDefault(stored, Setting.PAYMENT_METHOD_ID, config.getPaymentMethodId())));
    }

    @Transactional
    public void saveAll(Map<String, String> values) {
        values.forEach((key, value) -> repository.save(new Setting(key, value)));
        log.info("Settings updated: {}", values.keySet());
    }

    /** Stored settings with secrets shortened for display. */
    public Map<String, String> masked() {
        Map<String, String> result = new LinkedHashMap<>();
        storedValues().forEach((key, value) ->
                result.put(key, SECRET_KEYS.contains(key) ? mask(value) : value));
        return result;
    }

    static String mask(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        if (value.length() > 12) {
            return value.substring(0, 8) + "..." + value.substring(value.length() - 4);
        }
        return "***";
    }

    private Map<String, String> storedValues() {
        return repository.findAll().stream()
                .filter(s -> s.getValue() != null)
                .collect(Collectors.toMap(Setting::getKey, Setting::getValue, (a, b) -> b, LinkedHashMap::new));
    }

    private String valueOrDefault(Map<String, String> stored, String key, String fallback) {
        String value = stored.get(key);
        return value != null && !value.isBlank() ? value : fallback;
    }

    private Long parsePaymentMethod(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric payment_method_id '{}'", raw);
            return null;
        }
    }
}
