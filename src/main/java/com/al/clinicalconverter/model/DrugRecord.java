package com.al.clinicalconverter.model;

import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Document(collection = "drug_records")
@CompoundIndex(def = "{'conversionId': 1, 'createdAt': -1}", name = "conversion_created_idx")
public class DrugRecord {
    @Id
    private String id;

    private String conversionId;

    // Id of the linked PatientRecord; null when the patient was not stored
    @Indexed(sparse = true)
    private String patientRecordId;

    private String drugName;
    private String dosage;
    private String strength;
    private Integer quantity;
    private String originalPatientId;
    private String prescriptionId;
    private String administrationDate;
    private String completionStatus;
    private Map<String, String> metadata = new LinkedHashMap<>();

    private LocalDateTime createdAt;
}
