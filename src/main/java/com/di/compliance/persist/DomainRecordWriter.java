package com.di.compliance.persist;

import com.di.compliance.model.DomainRecord;
import com.di.compliance.model.RecordType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Routes a normalized record to the repository of its entity table.
 */
@Slf4j
@Component
public class DomainRecordWriter {

    private final Map<RecordType, DomainRecordRepository<?>> repositories = new EnumMap<>(RecordType.class);

    public DomainRecordWriter(List<DomainRecordRepository<?>> repositories) {
        for (DomainRecordRepository<?> repository : repositories) {
            DomainRecordRepository<?> previous = this.repositories.put(repository.recordType(), repository);
            if (previous != null) {
                throw new IllegalStateException("Duplicate repository for " + repository.recordType() + ": "
                        + previous.getClass().getSimpleName() + " and " + repository.getClass().getSimpleName());
            }
        }
        for (RecordType type : RecordType.values()) {
            if (!this.repositories.containsKey(type)) {
                throw new IllegalStateException("No repository registered for " + type);
            }
        }
        log.debug("[PERSIST] repositories registered for {}", this.repositories.keySet());
    }

    /**
     * Row id of an already persisted record with the same natural key, in any document.
     */
    public Optional<Long> findExisting(DomainRecord record) {
        return repository(record.getRecordType()).findIdByNaturalKey(record.getNaturalKey());
    }

    /**
     * Row id for a natural key of the given type, or empty when that record has not been ingested.
     */
    public Optional<Long> resolve(RecordType type, String naturalKey) {
        if (naturalKey == null || naturalKey.isBlank()) {
            return Optional.empty();
        }
        return repository(type).findIdByNaturalKey(naturalKey);
    }

    @SuppressWarnings("unchecked")
    public long insert(DomainRecord record) {
        DomainRecordRepository<DomainRecord> repository =
                (DomainRecordRepository<DomainRecord>) repository(record.getRecordType());
        return repository.insert(record);
    }

    private DomainRecordRepository<?> repository(RecordType type) {
        return repositories.get(type);
    }
}
