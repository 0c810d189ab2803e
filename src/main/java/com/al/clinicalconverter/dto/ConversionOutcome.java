package com.al.clinicalconverter.dto;

import com.al.clinicalconverter.model.ExtractionResult;
import com.al.clinicalconverter.model.enums.ConversionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of one {@code process()} run, returned synchronously to the caller.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversionOutcome {

    private String conversionId;

    /**
     * COMPLETED or FAILED
     */
    private ConversionStatus status;

    private int drugRecordsCount;
    private int patientsCount;
    private long processingTimeMs;

    /**
     * Verbatim failure message; null unless FAILED
     */
    private String error;

    /**
     * Extracted facts; null unless COMPLETED
     */
    private ExtractionResult extractionResult;

    public boolean isCompleted() {
        return status == ConversionStatus.COMPLETED;
    }
}
