package com.al.clinicalconverter.service;

import com.al.clinicalconverter.dto.ConversionOutcome;
import com.al.clinicalconverter.dto.ConversionSnapshot;
import com.al.clinicalconverter.dto.ConversionStatusView;
import com.al.clinicalconverter.exception.ConversionNotFoundException;
import com.al.clinicalconverter.model.enums.ConversionStatus;
import com.al.clinicalconverter.model.enums.ConversionType;
import com.al.clinicalconverter.parser.ClinicalParserRegistry;
import com.al.clinicalconverter.repository.ConversionStore;
import com.al.clinicalconverter.repository.DrugRecordStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for callers: create a conversion, run it, query its status.
 */
@Slf4j
@Service
public class ConversionManager {

    private final ConversionStore conversionStore;
    private final DrugRecordStore drugRecordStore;
    private final ClinicalParserRegistry parserRegistry;
    private final ConversionProcessor processor;
    private final ConversionDataValidator validator;

    public ConversionManager(ConversionStore conversionStore, DrugRecordStore drugRecordStore,
            ClinicalParserRegistry parserRegistry, ConversionProcessor processor,
            ConversionDataValidator validator) {
        this.conversionStore = conversionStore;
        this.drugRecordStore = drugRecordStore;
        this.parserRegistry = parserRegistry;
        this.processor = processor;
        this.validator = validator;
    }

    /**
     * Stores the input as a PENDING conversion. Invalid input is still
     * stored; it fails when processed.
     *
     * @return the new conversion id
     */
    public String createConversion(ConversionType type, String sourceText) {
        String conversionId = UUID.randomUUID().toString();
        List<String> problems = validator.validate(type, sourceText);
        if (!problems.isEmpty()) {
            log.warn("Conversion {} created with invalid {} input: {}", conversionId, type, problems);
        }
        conversionStore.createConversion(conversionId, type, sourceText);
        log.info("Created {} conversion {}", type, conversionId);
        return conversionId;
    }

    /**
     * @throws ConversionNotFoundException for an unknown id
     */
    public ConversionOutcome processConversion(String conversionId) {
        ConversionSnapshot conversion = conversionStore.findConversion(conversionId)
                .orElseThrow(() -> new ConversionNotFoundException(conversionId));
        return processor.process(conversionId, conversion.getSourceData(),
                parserRegistry.getParser(conversion.getConversionType()));
    }

    public Optional<ConversionStatusView> getConversionStatus(String conversionId) {
        return conversionStore.findConversion(conversionId)
                .map(conversion -> ConversionStatusView.builder()
                        .conversionId(conversion.getConversionId())
                        .status(conversion.getStatus())
                        .conversionType(conversion.getConversionType())
                        .createdAt(conversion.getCreatedAt())
                        .updatedAt(conversion.getUpdatedAt())
                        .drugRecordsCount(drugRecordStore.countDrugRecords(conversionId))
                        .errorMessage(conversion.getStatus() == ConversionStatus.FAILED
                                ? conversion.getErrorMessage()
                                : null)
                        .build());
    }
}
