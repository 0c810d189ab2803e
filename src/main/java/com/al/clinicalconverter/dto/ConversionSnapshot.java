package com.al.clinicalconverter.dto;

import com.al.clinicalconverter.model.enums.ConversionStatus;
import com.al.clinicalconverter.model.enums.ConversionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Read-only copy of a stored conversion, independent of the store.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversionSnapshot {
    private String conversionId;
    private ConversionType conversionType;
    private String sourceData;
    private ConversionStatus status;
    private Map<String, Object> convertedData;
    private String errorMessage;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
