package com.xksgroup.conversionengine.repo;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SettingEntryRepository extends MongoRepository<SettingEntry, String> {
}
