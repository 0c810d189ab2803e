package com.al.clinicalconverter.repository;

import com.al.clinicalconverter.dto.ConversionSnapshot;
import com.al.clinicalconverter.model.enums.ConversionStatus;
import com.al.clinicalconverter.model.enums.ConversionType;

import java.util.Map;
import java.util.Optional;

/**
 * Durable conversion state. Implementations serialize updates per
 * conversion id.
 */
public interface ConversionStore {

    /**
     * Stores a new conversion in {@link ConversionStatus#PENDING}.
     */
    void createConversion(String conversionId, ConversionType type, String sourceText);

    /**
     * Sets the status. A null or empty payload or error message leaves the
     * stored value unchanged.
     *
     * @throws com.al.clinicalconverter.exception.ConversionNotFoundException
     *         for an unknown id
     */
    void updateConversionStatus(String conversionId, ConversionStatus status, Map<String, Object> convertedPayload,
            String errorMessage);

    Optional<ConversionSnapshot> findConversion(String conversionId);
}
