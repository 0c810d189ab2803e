package com.al.clinicalconverter.model;

import com.al.clinicalconverter.model.enums.ConversionStatus;
import com.al.clinicalconverter.model.enums.ConversionType;
import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Document(collection = "data_conversions")
public class ConversionRecord {
    @Id
    private String id;

    @Indexed(unique = true)
    private String conversionId;

    private ConversionType conversionType;
    private String sourceData;
    private ConversionStatus status;

    // Parsed tree and counts, set on COMPLETED
    private Map<String, Object> convertedData = new LinkedHashMap<>();
    private String errorMessage;

    @Indexed
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
