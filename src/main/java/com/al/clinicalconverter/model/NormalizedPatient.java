package com.al.clinicalconverter.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Patient facts in the format-agnostic shape shared by the HL7 and XML
 * extractors. An empty {@code patientId} means no patient was resolved.
 */
@Value
@Builder(toBuilder = true)
public class NormalizedPatient {

    @Builder.Default
    String patientId = "";
    @Builder.Default
    String firstName = "";
    @Builder.Default
    String lastName = "";
    @Builder.Default
    String fullName = "";

    /**
     * ISO {@code YYYY-MM-DD}, or empty when unknown.
     */
    @Builder.Default
    String dateOfBirth = "";
    @Builder.Default
    String gender = "";
    @Builder.Default
    String address = "";
    @Builder.Default
    String phoneNumber = "";

    // XML sources only
    Integer age;

    @Singular("metadataEntry")
    Map<String, String> metadata;

    public boolean isResolved() {
        return patientId != null && !patientId.isEmpty();
    }
}
