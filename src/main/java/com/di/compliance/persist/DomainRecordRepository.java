package com.di.compliance.persist;

import com.di.compliance.model.DomainRecord;
import com.di.compliance.model.RecordType;

import java.util.Optional;

/**
 * Lookup-by-natural-key and insert for one business entity table.
 */
public interface DomainRecordRepository<T extends DomainRecord> {

    RecordType recordType();

    Optional<Long> findIdByNaturalKey(String naturalKey);

    /**
     * @return generated row id
     * @throws org.springframework.dao.DuplicateKeyException when the natural key already exists
     */
    long insert(T record);
}
