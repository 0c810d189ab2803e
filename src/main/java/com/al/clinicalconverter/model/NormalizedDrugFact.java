package com.al.clinicalconverter.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * One drug administration or prescription fact. Facts without a drug name
 * are dropped before they reach an {@link ExtractionResult}.
 */
@Value
@Builder(toBuilder = true)
public class NormalizedDrugFact {

    @Builder.Default
    String drugName = "";
    @Builder.Default
    String dosage = "";
    @Builder.Default
    String strength = "";

    /**
     * Non-negative count, or null when the source value was not an integer.
     */
    Integer quantity;

    @Builder.Default
    String patientId = "";
    @Builder.Default
    String prescriptionId = "";

    // RXA only
    @Builder.Default
    String administrationDate = "";
    @Builder.Default
    String completionStatus = "";

    @Singular("metadataEntry")
    Map<String, String> metadata;

    public boolean hasDrugName() {
        return drugName != null && !drugName.isEmpty();
    }
}
