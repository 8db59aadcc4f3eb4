package com.di.compliance.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MaintenanceEvent implements DomainRecord {

    private Long       id;
    private String     eventId;
    private Long       documentId;

    private String     site;
    private String     machineId;
    private String     machineDescription;
    private String     eventType;
    private LocalDate  eventDate;
    private BigDecimal downtimeHours;
    private String     technician;
    private String     description;
    private String     partsReplaced;
    private String     notes;

    @Override
    public RecordType getRecordType() {
        return RecordType.MAINTENANCE;
    }

    @Override
    public String getNaturalKey() {
        return eventId;
    }
}
