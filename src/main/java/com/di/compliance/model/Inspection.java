package com.di.compliance.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Quality inspection outcome. Measured value and spec bounds share {@link #measurementUnit}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Inspection implements DomainRecord {

    private Long             id;
    private String           inspectionId;
    private Long             documentId;

    private String           site;
    private String           productionLine;
    private String           supplier;
    private String           partNumber;
    private String           partDescription;
    private LocalDate        inspectionDate;
    private String           inspector;
    private InspectionResult result;

    // ---- measurement -------------------------------------------------------
    private BigDecimal       measurementValue;
    private String           measurementUnit;
    private BigDecimal       specMin;
    private BigDecimal       specMax;

    private String           notes;

    @Override
    public RecordType getRecordType() {
        return RecordType.INSPECTION;
    }

    @Override
    public String getNaturalKey() {
        return inspectionId;
    }
}
