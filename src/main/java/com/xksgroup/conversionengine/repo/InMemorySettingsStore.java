package com.xksgroup.conversionengine.repo;

import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

@Repository
@Profile("!mongo")
public class InMemorySettingsStore implements SettingsStore {

    private final Map<String, String> settings = new ConcurrentHashMap<>();

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(settings.get(key));
    }

    @Override
    public void put(String key, String value) {
        settings.put(key, value);
    }

    @Override
    public Map<String, String> all() {
        return new TreeMap<>(settings);
    }
}
