package com.al.clinicalconverter.repository;

import com.al.clinicalconverter.model.DrugRecord;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DrugRecordRepository extends MongoRepository<DrugRecord, String> {
    List<DrugRecord> findByConversionId(String conversionId);

    List<DrugRecord> findByPatientRecordId(String patientRecordId);

    long countByConversionId(String conversionId);

    long deleteByConversionId(String conversionId);
}
