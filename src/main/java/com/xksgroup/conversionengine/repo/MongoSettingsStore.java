package com.xksgroup.conversionengine.repo;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

@Component
@Profile("mongo")
@RequiredArgsConstructor
public class MongoSettingsStore implements SettingsStore {

    private final SettingEntryRepository settingEntryRepository;

    @Override
    public Optional<String> get(String key) {
        return settingEntryRepository.findById(key).map(SettingEntry::getValue);
    }

    @Override
    public void put(String key, String value) {
        settingEntryRepository.save(SettingEntry.builder()
                .key(key)
                .value(value)
                .updatedAt(LocalDateTime.now())
                .build());
    }

    @Override
    public Map<String, String> all() {
        Map<String, String> result = new TreeMap<>();
        settingEntryRepository.findAll().forEach(entry -> result.put(entry.getKey(), entry.getValue()));
        return result;
    }
}
