package com.al.clinicalconverter.model;

import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Document(collection = "patients")
public class PatientRecord {
    @Id
    private String id;

    // Source system identifier (PID-3, PV1-19, <patient><id>)
    @Indexed(unique = true)
    private String patientId;

    private String firstName;
    private String lastName;
    private String fullName;
    private Integer age;
    private String gender;
    private String dateOfBirth; // ISO yyyy-MM-dd
    private String address;
    private String phoneNumber;
    private Map<String, String> metadata = new LinkedHashMap<>();

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
