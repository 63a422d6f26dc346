package com.di.accesslogs.config;

import java.util.List;

/**
 * Thrown at startup when required settings are absent or unusable. Lists every problem at once
 * so a deployment can be fixed in one pass.
 */
public class ConfigurationException extends RuntimeException {

    private final List<String> missingKeys;
    private final List<String> invalidSettings;

    public ConfigurationException(List<String> missingKeys, List<String> invalidSettings) {
        super(buildMessage(missingKeys, invalidSettings));
        this.missingKeys = List.copyOf(missingKeys);
        this.invalidSettings = List.copyOf(invalidSettings);
    }

    public List<String> getMissingKeys() {
        return missingKeys;
    }

    public List<String> getInvalidSettings() {
        return invalidSettings;
    }

    private static String buildMessage(List<String> missingKeys, List<String> invalidSettings) {
        StringBuilder sb = new StringBuilder("Invalid access log pipeline configuration.");
        if (!missingKeys.isEmpty()) {
            sb.append(" Missing required keys: ").append(String.join(", ", missingKeys)).append('.');
        }
        if (!invalidSettings.isEmpty()) {
            sb.append(" Invalid settings: ").append(String.join("; ", invalidSettings)).append('.');
        }
        return sb.toString();
    }
}
