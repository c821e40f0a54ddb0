package org.decide.authentication.shared.services;

public class SystemService {
    public String getenv(String name) {
        return System.getenv(name);
    }

    public String getOrDefault(String key, String defaultValue) {
        return System.getenv().getOrDefault(key, defaultValue);
    }
}
