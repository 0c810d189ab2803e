package com.al.clinicalconverter.service;

import com.al.clinicalconverter.ParserFixtures;
import com.al.clinicalconverter.config.ConversionProperties;
import com.al.clinicalconverter.dto.ConversionOutcome;
import com.al.clinicalconverter.exception.ConversionNotFoundException;
import com.al.clinicalconverter.model.ExtractionResult;
import com.al.clinicalconverter.model.NormalizedPatient;
import com.al.clinicalconverter.model.enums.ConversionStatus;
import com.al.clinicalconverter.parser.hl7.Hl7Parser;
import com.al.clinicalconverter.parser.xml.XmlParser;
import com.al.clinicalconverter.repository.ConversionStore;
import com.al.clinicalconverter.repository.DrugRecordStore;
import com.al.clinicalconverter.repository.PatientStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class ConversionProcessorTest {

    private static final String CONVERSION_ID = "conv-1";

    @Mock
    private ConversionStore conversionStore;

    @Mock
    private DrugRecordStore drugRecordStore;

    @Mock
    private PatientStore patientStore;

    @Captor
    private ArgumentCaptor<Map<String, Object>> payloadCaptor;

    private SimpleMeterRegistry meterRegistry;
    private ConversionProperties properties;
    private ConversionProcessor processor;

    private final Hl7Parser hl7Parser = ParserFixtures.hl7Parser();
    private final XmlParser xmlParser = ParserFixtures.xmlParser();

    @BeforeEach
    public void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        properties = new ConversionProperties();
        processor = new ConversionProcessor(conversionStore, drugRecordStore, patientStore, meterRegistry,
                properties);
    }

    @Test
    public void testProcessHl7_Completed() {
        when(patientStore.getOrCreatePatient(any(NormalizedPatient.class))).thenReturn(Optional.of("p-1"));
        when(drugRecordStore.createDrugRecords(eq(CONVERSION_ID), any(ExtractionResult.class)))
                .thenReturn(List.of("d-1", "d-2"));

        ConversionOutcome outcome = processor.process(CONVERSION_ID, ParserFixtures.sample("orm_o01_rxe.hl7"),
                hl7Parser);

        assertTrue(outcome.isCompleted());
        assertEquals(2, outcome.getDrugRecordsCount());
        assertEquals(1, outcome.getPatientsCount());
        assertNull(outcome.getError());
        assertEquals("Aspirin", outcome.getExtractionResult().getDrugRecords().get(0).getDrugName());

        verify(conversionStore).updateConversionStatus(CONVERSION_ID, ConversionStatus.PROCESSING, null, null);
        verify(conversionStore).updateConversionStatus(eq(CONVERSION_ID), eq(ConversionStatus.COMPLETED),
                payloadCaptor.capture(), isNull());
        Map<String, Object> payload = payloadCaptor.getValue();
        assertEquals(2, payload.get("drug_records_count"));
        assertEquals(1, payload.get("patients_count"));
        assertTrue(payload.containsKey("processing_time_ms"));
        assertTrue(payload.get("parsed_data") instanceof Map);

        verify(patientStore, times(1)).getOrCreatePatient(any(NormalizedPatient.class));
        assertEquals(1.0, meterRegistry.counter(ConversionProcessor.METRIC_COUNT,
                "type", "HL7", "status", "COMPLETED").count());
        assertEquals(1L, meterRegistry.timer(ConversionProcessor.METRIC_DURATION,
                "type", "HL7", "status", "COMPLETED").count());
        assertNull(MDC.get(ConversionProcessor.MDC_CONVERSION_ID));
    }

    @Test
    public void testProcessXml_WithoutParsedData() {
        properties.setIncludeParsedDataInPayload(false);
        when(patientStore.getOrCreatePatient(any(NormalizedPatient.class))).thenReturn(Optional.of("p-1"));
        when(drugRecordStore.createDrugRecords(eq(CONVERSION_ID), any(ExtractionResult.class)))
                .thenReturn(List.of("d-1", "d-2"));

        ConversionOutcome outcome = processor.process(CONVERSION_ID, ParserFixtures.sample("prescription.xml"),
                xmlParser);

        assertEquals(ConversionStatus.COMPLETED, outcome.getStatus());
        verify(conversionStore).updateConversionStatus(eq(CONVERSION_ID), eq(ConversionStatus.COMPLETED),
                payloadCaptor.capture(), isNull());
        assertFalse(payloadCaptor.getValue().containsKey("parsed_data"));
        assertEquals(2, payloadCaptor.getValue().get("drug_records_count"));
    }

    @Test
    public void testProcessInvalidHl7_Failed() {
        ConversionOutcome outcome = processor.process(CONVERSION_ID, "Invalid HL7 data", hl7Parser);

        assertEquals(ConversionStatus.FAILED, outcome.getStatus());
        assertFalse(outcome.isCompleted());
        assertTrue(outcome.getError().contains("MSH"));
        assertNull(outcome.getExtractionResult());

        verify(conversionStore).updateConversionStatus(CONVERSION_ID, ConversionStatus.FAILED, null,
                outcome.getError());
        verify(conversionStore, never()).updateConversionStatus(anyString(), eq(ConversionStatus.COMPLETED),
                any(), any());
        verifyNoInteractions(drugRecordStore, patientStore);
        assertEquals(1.0, meterRegistry.counter(ConversionProcessor.METRIC_COUNT,
                "type", "HL7", "status", "FAILED").count());
    }

    @Test
    public void testProcessInvalidXml_FailedWithParserDiagnostic() {
        ConversionOutcome outcome = processor.process(CONVERSION_ID, "<invalid>xml", xmlParser);

        assertEquals(ConversionStatus.FAILED, outcome.getStatus());
        assertTrue(outcome.getError().startsWith("Invalid XML data: "));
        verify(conversionStore).updateConversionStatus(CONVERSION_ID, ConversionStatus.FAILED, null,
                outcome.getError());
    }

    @Test
    public void testProcessStoreFailure_MessageStoredVerbatim() {
        when(drugRecordStore.createDrugRecords(eq(CONVERSION_ID), any(ExtractionResult.class)))
                .thenThrow(new ConversionNotFoundException(CONVERSION_ID));

        ConversionOutcome outcome = processor.process(CONVERSION_ID,
                "MSH|^~\\&|App|Fac|||20150202||RDE^O11|1|P|2.5\rRXE|^Aspirin|81MG", hl7Parser);

        assertEquals(ConversionStatus.FAILED, outcome.getStatus());
        assertEquals("Conversion not found: " + CONVERSION_ID, outcome.getError());
        verify(conversionStore).updateConversionStatus(CONVERSION_ID, ConversionStatus.FAILED, null,
                "Conversion not found: " + CONVERSION_ID);
        verify(drugRecordStore, never()).deleteDrugRecords(anyString());
        assertNull(MDC.get(ConversionProcessor.MDC_CONVERSION_ID));
    }

    @Test
    public void testProcessExceptionWithoutMessage_UsesClassName() {
        when(drugRecordStore.createDrugRecords(eq(CONVERSION_ID), any(ExtractionResult.class)))
                .thenThrow(new IllegalStateException());

        ConversionOutcome outcome = processor.process(CONVERSION_ID,
                "MSH|^~\\&|App|Fac|||20150202||RDE^O11|1|P|2.5\rRXE|^Aspirin|81MG", hl7Parser);

        assertEquals("IllegalStateException", outcome.getError());
    }

    @Test
    public void testProcessCompletedUpdateFails_DrugRecordsRemoved() {
        when(patientStore.getOrCreatePatient(any(NormalizedPatient.class))).thenReturn(Optional.of("p-1"));
        when(drugRecordStore.createDrugRecords(eq(CONVERSION_ID), any(ExtractionResult.class)))
                .thenReturn(List.of("d-1", "d-2"));
        lenient().doThrow(new IllegalStateException("write failed")).when(conversionStore)
                .updateConversionStatus(eq(CONVERSION_ID), eq(ConversionStatus.COMPLETED), any(), any());

        ConversionOutcome outcome = processor.process(CONVERSION_ID, ParserFixtures.sample("orm_o01_rxe.hl7"),
                hl7Parser);

        assertEquals(ConversionStatus.FAILED, outcome.getStatus());
        assertEquals("write failed", outcome.getError());
        verify(drugRecordStore).deleteDrugRecords(CONVERSION_ID);
        verify(conversionStore).updateConversionStatus(CONVERSION_ID, ConversionStatus.FAILED, null,
                "write failed");
    }

    @Test
    public void testProcessCleanupFailure_StillMarkedFailed() {
        when(patientStore.getOrCreatePatient(any(NormalizedPatient.class))).thenReturn(Optional.of("p-1"));
        when(drugRecordStore.createDrugRecords(eq(CONVERSION_ID), any(ExtractionResult.class)))
                .thenReturn(List.of("d-1"));
        lenient().doThrow(new IllegalStateException("write failed")).when(conversionStore)
                .updateConversionStatus(eq(CONVERSION_ID), eq(ConversionStatus.COMPLETED), any(), any());
        doThrow(new IllegalStateException("delete failed")).when(drugRecordStore).deleteDrugRecords(CONVERSION_ID);

        ConversionOutcome outcome = processor.process(CONVERSION_ID, ParserFixtures.sample("orm_o01_rxe.hl7"),
                hl7Parser);

        assertEquals(ConversionStatus.FAILED, outcome.getStatus());
        assertEquals("write failed", outcome.getError());
        verify(conversionStore).updateConversionStatus(CONVERSION_ID, ConversionStatus.FAILED, null,
                "write failed");
    }
}
