package com.al.clinicalconverter.service;

import com.al.clinicalconverter.config.ConversionProperties;
import com.al.clinicalconverter.dto.ConversionOutcome;
import com.al.clinicalconverter.exception.InvalidFormatException;
import com.al.clinicalconverter.model.ExtractionResult;
import com.al.clinicalconverter.model.NormalizedPatient;
import com.al.clinicalconverter.model.enums.ConversionStatus;
import com.al.clinicalconverter.parser.ClinicalParser;
import com.al.clinicalconverter.repository.ConversionStore;
import com.al.clinicalconverter.repository.DrugRecordStore;
import com.al.clinicalconverter.repository.PatientStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one conversion: validate, parse, extract, persist, record the
 * outcome.
 *
 * <p>
 * Status moves PROCESSING then COMPLETED, or FAILED with the exception
 * message stored verbatim. Failures are returned in the outcome, never
 * retried.
 */
@Service
public class ConversionProcessor {

    private static final Logger log = LoggerFactory.getLogger(ConversionProcessor.class);

    static final String MDC_CONVERSION_ID = "conversionId";
    static final String METRIC_DURATION = "clinical.conversion.duration";
    static final String METRIC_COUNT = "clinical.conversion.count";

    private final ConversionStore conversionStore;
    private final DrugRecordStore drugRecordStore;
    private final PatientStore patientStore;
    private final MeterRegistry meterRegistry;
    private final ConversionProperties properties;

    public ConversionProcessor(ConversionStore conversionStore, DrugRecordStore drugRecordStore,
            PatientStore patientStore, MeterRegistry meterRegistry, ConversionProperties properties) {
        this.conversionStore = conversionStore;
        this.drugRecordStore = drugRecordStore;
        this.patientStore = patientStore;
        this.meterRegistry = meterRegistry;
        this.properties = properties;
    }

    public <T> ConversionOutcome process(String conversionId, String sourceText, ClinicalParser<T> parser) {
        String type = parser.getType().name();
        Timer.Sample sample = Timer.start(meterRegistry);
        long start = System.nanoTime();
        MDC.put(MDC_CONVERSION_ID, conversionId);
        boolean recordsStored = false;
        try {
            log.info("Starting {} conversion {}", type, conversionId);
            conversionStore.updateConversionStatus(conversionId, ConversionStatus.PROCESSING, null, null);

            if (!parser.validate(sourceText)) {
                // parse() throws the parser's InvalidFormatException, whose message the caller sees.
                // The generic one below only fires if parse() accepts what validate() rejected.
                parser.parse(sourceText);
                throw new InvalidFormatException(parser.getType(), "Invalid " + type + " data format");
            }
            T parsed = parser.parse(sourceText);
            log.debug("Parsing completed, data size {}", sourceText.length());

            ExtractionResult extraction = parser.extractClinicalData(parsed, parser.rawSegments(sourceText));
            log.debug("Extraction completed: {} drug record(s), {} patient(s)",
                    extraction.getDrugRecords().size(), extraction.getPatients().size());

            for (NormalizedPatient patient : extraction.getPatients()) {
                patientStore.getOrCreatePatient(patient);
            }
            List<String> savedRecords = drugRecordStore.createDrugRecords(conversionId, extraction);
            recordsStored = true;
            long elapsedMs = elapsedMs(start);

            Map<String, Object> payload = new LinkedHashMap<>();
            if (properties.isIncludeParsedDataInPayload()) {
                payload.put("parsed_data", parser.toPayload(parsed));
            }
            payload.put("drug_records_count", savedRecords.size());
            payload.put("patients_count", extraction.getPatients().size());
            payload.put("processing_time_ms", elapsedMs);
            conversionStore.updateConversionStatus(conversionId, ConversionStatus.COMPLETED, payload, null);

            record(sample, type, ConversionStatus.COMPLETED, elapsedMs);
            log.info("Conversion {} COMPLETED in {} ms", conversionId, elapsedMs);
            return ConversionOutcome.builder()
                    .conversionId(conversionId)
                    .status(ConversionStatus.COMPLETED)
                    .drugRecordsCount(savedRecords.size())
                    .patientsCount(extraction.getPatients().size())
                    .processingTimeMs(elapsedMs)
                    .extractionResult(extraction)
                    .build();
        } catch (RuntimeException e) {
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            long elapsedMs = elapsedMs(start);
            log.error("Conversion {} FAILED after {} ms: {}", conversionId, elapsedMs, error, e);

            if (recordsStored) {
                discardDrugRecords(conversionId, e);
            }
            conversionStore.updateConversionStatus(conversionId, ConversionStatus.FAILED, null, error);
            record(sample, type, ConversionStatus.FAILED, elapsedMs);
            return ConversionOutcome.builder()
                    .conversionId(conversionId)
                    .status(ConversionStatus.FAILED)
                    .processingTimeMs(elapsedMs)
                    .error(error)
                    .build();
        } finally {
            MDC.remove(MDC_CONVERSION_ID);
        }
    }

    // A FAILED conversion keeps no drug records
    private void discardDrugRecords(String conversionId, RuntimeException cause) {
        try {
            drugRecordStore.deleteDrugRecords(conversionId);
        } catch (RuntimeException deleteFailure) {
            cause.addSuppressed(deleteFailure);
            log.error("Could not remove drug records of failed conversion {}", conversionId, deleteFailure);
        }
    }

    private void record(Timer.Sample sample, String type, ConversionStatus status, long elapsedMs) {
        sample.stop(meterRegistry.timer(METRIC_DURATION, "type", type, "status", status.name()));
        meterRegistry.counter(METRIC_COUNT, "type", type, "status", status.name()).increment();
        if (elapsedMs > properties.getSlowConversionThresholdMs()) {
            log.warn("Slow {} conversion: {} ms (threshold {} ms)", type, elapsedMs,
                    properties.getSlowConversionThresholdMs());
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
