package com.al.clinicalconverter.repository;

import com.al.clinicalconverter.model.ConversionRecord;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ConversionRecordRepository extends MongoRepository<ConversionRecord, String> {
    Optional<ConversionRecord> findByConversionId(String conversionId);
}
