package com.al.clinicalconverter.repository;

import com.al.clinicalconverter.dto.ConversionSnapshot;
import com.al.clinicalconverter.exception.ConversionNotFoundException;
import com.al.clinicalconverter.model.ConversionRecord;
import com.al.clinicalconverter.model.DrugRecord;
import com.al.clinicalconverter.model.ExtractionResult;
import com.al.clinicalconverter.model.NormalizedDrugFact;
import com.al.clinicalconverter.model.NormalizedPatient;
import com.al.clinicalconverter.model.PatientRecord;
import com.al.clinicalconverter.model.enums.ConversionStatus;
import com.al.clinicalconverter.model.enums.ConversionType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * MongoDB-backed conversion, patient and drug record storage.
 */
@Slf4j
@Component
public class MongoConversionStore implements ConversionStore, DrugRecordStore, PatientStore {

    private final ConversionRecordRepository conversionRepository;
    private final PatientRecordRepository patientRepository;
    private final DrugRecordRepository drugRecordRepository;

    public MongoConversionStore(ConversionRecordRepository conversionRepository,
            PatientRecordRepository patientRepository, DrugRecordRepository drugRecordRepository) {
        this.conversionRepository = conversionRepository;
        this.patientRepository = patientRepository;
        this.drugRecordRepository = drugRecordRepository;
    }

    // ========================================================================
    // Conversions
    // ========================================================================

    @Override
    public void createConversion(String conversionId, ConversionType type, String sourceText) {
        LocalDateTime now = LocalDateTime.now();
        ConversionRecord record = new ConversionRecord();
        record.setConversionId(conversionId);
        record.setConversionType(type);
        record.setSourceData(sourceText);
        record.setStatus(ConversionStatus.PENDING);
        record.setCreatedAt(now);
        record.setUpdatedAt(now);
        conversionRepository.save(record);
    }

    @Override
    public void updateConversionStatus(String conversionId, ConversionStatus status,
            Map<String, Object> convertedPayload, String errorMessage) {
        ConversionRecord record = conversionRepository.findByConversionId(conversionId)
                .orElseThrow(() -> new ConversionNotFoundException(conversionId));
        record.setStatus(status);
        if (convertedPayload != null && !convertedPayload.isEmpty()) {
            record.setConvertedData(new LinkedHashMap<>(convertedPayload));
        }
        if (errorMessage != null && !errorMessage.isEmpty()) {
            record.setErrorMessage(errorMessage);
        }
        record.setUpdatedAt(LocalDateTime.now());
        conversionRepository.save(record);
    }

    @Override
    public Optional<ConversionSnapshot> findConversion(String conversionId) {
        return conversionRepository.findByConversionId(conversionId)
                .map(record -> ConversionSnapshot.builder()
                        .conversionId(record.getConversionId())
                        .conversionType(record.getConversionType())
                        .sourceData(record.getSourceData())
                        .status(record.getStatus())
                        .convertedData(record.getConvertedData())
                        .errorMessage(record.getErrorMessage())
                        .createdAt(record.getCreatedAt())
                        .updatedAt(record.getUpdatedAt())
                        .build());
    }

    // ========================================================================
    // Patients
    // ========================================================================

    @Override
    public Optional<String> getOrCreatePatient(NormalizedPatient patient) {
        if (!patient.isResolved()) {
            return Optional.empty();
        }
        Optional<PatientRecord> existing = patientRepository.findByPatientId(patient.getPatientId());
        if (existing.isPresent()) {
            PatientRecord record = existing.get();
            if (mergeInto(record, patient)) {
                record.setUpdatedAt(LocalDateTime.now());
                patientRepository.save(record);
                log.debug("Updated stored patient {}", patient.getPatientId());
            }
            return Optional.of(record.getId());
        }

        LocalDateTime now = LocalDateTime.now();
        PatientRecord record = new PatientRecord();
        record.setPatientId(patient.getPatientId());
        record.setFirstName(patient.getFirstName());
        record.setLastName(patient.getLastName());
        record.setFullName(patient.getFullName());
        record.setAge(patient.getAge());
        record.setGender(patient.getGender());
        record.setDateOfBirth(patient.getDateOfBirth());
        record.setAddress(patient.getAddress());
        record.setPhoneNumber(patient.getPhoneNumber());
        record.setMetadata(new LinkedHashMap<>(patient.getMetadata()));
        record.setCreatedAt(now);
        record.setUpdatedAt(now);
        return Optional.of(patientRepository.save(record).getId());
    }

    /**
     * Copies non-empty incoming values that differ from the stored ones.
     *
     * @return whether anything changed
     */
    private static boolean mergeInto(PatientRecord record, NormalizedPatient patient) {
        boolean changed = false;
        changed |= mergeText(record.getFirstName(), patient.getFirstName(), record::setFirstName);
        changed |= mergeText(record.getLastName(), patient.getLastName(), record::setLastName);
        changed |= mergeText(record.getFullName(), patient.getFullName(), record::setFullName);
        changed |= mergeText(record.getGender(), patient.getGender(), record::setGender);
        changed |= mergeText(record.getDateOfBirth(), patient.getDateOfBirth(), record::setDateOfBirth);
        changed |= mergeText(record.getAddress(), patient.getAddress(), record::setAddress);
        changed |= mergeText(record.getPhoneNumber(), patient.getPhoneNumber(), record::setPhoneNumber);
        if (patient.getAge() != null && !patient.getAge().equals(record.getAge())) {
            record.setAge(patient.getAge());
            changed = true;
        }
        return changed;
    }

    private static boolean mergeText(String current, String incoming, Consumer<String> setter) {
        if (incoming == null || incoming.isEmpty() || incoming.equals(current)) {
            return false;
        }
        setter.accept(incoming);
        return true;
    }

    // ========================================================================
    // Drug records
    // ========================================================================

    @Override
    public List<String> createDrugRecords(String conversionId, ExtractionResult result) {
        if (conversionRepository.findByConversionId(conversionId).isEmpty()) {
            throw new ConversionNotFoundException(conversionId);
        }

        Map<String, String> storedPatientIds = new LinkedHashMap<>();
        for (NormalizedPatient patient : result.getPatients()) {
            patientRepository.findByPatientId(patient.getPatientId())
                    .ifPresent(record -> storedPatientIds.put(record.getPatientId(), record.getId()));
        }

        LocalDateTime now = LocalDateTime.now();
        List<DrugRecord> records = new ArrayList<>();
        for (NormalizedDrugFact fact : result.getDrugRecords()) {
            DrugRecord record = new DrugRecord();
            record.setConversionId(conversionId);
            record.setPatientRecordId(storedPatientIds.get(fact.getPatientId()));
            record.setDrugName(fact.getDrugName());
            record.setDosage(fact.getDosage());
            record.setStrength(fact.getStrength());
            record.setQuantity(fact.getQuantity());
            record.setOriginalPatientId(fact.getPatientId());
            record.setPrescriptionId(fact.getPrescriptionId());
            record.setAdministrationDate(fact.getAdministrationDate());
            record.setCompletionStatus(fact.getCompletionStatus());
            record.setMetadata(new LinkedHashMap<>(fact.getMetadata()));
            record.setCreatedAt(now);
            records.add(record);
        }

        List<String> ids = new ArrayList<>();
        for (DrugRecord saved : drugRecordRepository.saveAll(records)) {
            ids.add(saved.getId());
        }
        log.debug("Stored {} drug record(s) for conversion {}", ids.size(), conversionId);
        return ids;
    }

    @Override
    public long countDrugRecords(String conversionId) {
        return drugRecordRepository.countByConversionId(conversionId);
    }

    @Override
    public void deleteDrugRecords(String conversionId) {
        long removed = drugRecordRepository.deleteByConversionId(conversionId);
        log.debug("Removed {} drug record(s) for conversion {}", removed, conversionId);
    }
}
