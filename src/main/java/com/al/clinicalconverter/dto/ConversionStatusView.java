package com.al.clinicalconverter.dto;

import com.al.clinicalconverter.model.enums.ConversionStatus;
import com.al.clinicalconverter.model.enums.ConversionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversionStatusView {
    private String conversionId;
    private ConversionStatus status;
    private ConversionType conversionType;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private long drugRecordsCount;

    /**
     * Only set for FAILED conversions
     */
    private String errorMessage;
}
