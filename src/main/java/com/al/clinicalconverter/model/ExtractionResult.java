package com.al.clinicalconverter.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Patients and drug facts extracted from one message, in source order.
 * Both parsers produce this same shape.
 */
@Value
@Builder
public class ExtractionResult {

    @Singular
    List<NormalizedPatient> patients;

    @Singular
    List<NormalizedDrugFact> drugRecords;

    public static ExtractionResult empty() {
        return ExtractionResult.builder().build();
    }

    /**
     * This result followed by {@code other}.
     */
    public ExtractionResult concat(ExtractionResult other) {
        List<NormalizedPatient> allPatients = new ArrayList<>(patients);
        allPatients.addAll(other.getPatients());
        List<NormalizedDrugFact> allDrugs = new ArrayList<>(drugRecords);
        allDrugs.addAll(other.getDrugRecords());
        return ExtractionResult.builder()
                .patients(allPatients)
                .drugRecords(allDrugs)
                .build();
    }
}
