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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class MongoConversionStoreTest {

    @Mock
    private ConversionRecordRepository conversionRepository;

    @Mock
    private PatientRecordRepository patientRepository;

    @Mock
    private DrugRecordRepository drugRecordRepository;

    @InjectMocks
    private MongoConversionStore store;

    @Captor
    private ArgumentCaptor<List<DrugRecord>> drugRecordsCaptor;

    private static ConversionRecord conversion(String conversionId) {
        ConversionRecord record = new ConversionRecord();
        record.setId("mongo-" + conversionId);
        record.setConversionId(conversionId);
        record.setConversionType(ConversionType.HL7);
        record.setSourceData("MSH|...");
        record.setStatus(ConversionStatus.PENDING);
        return record;
    }

    private static PatientRecord storedPatient(String id, String patientId) {
        PatientRecord record = new PatientRecord();
        record.setId(id);
        record.setPatientId(patientId);
        record.setFullName("JOHN DOE");
        record.setGender("M");
        record.setAddress("123 MAIN ST");
        return record;
    }

    @Test
    public void testCreateConversion_Pending() {
        store.createConversion("c1", ConversionType.XML, "<a/>");

        ArgumentCaptor<ConversionRecord> captor = ArgumentCaptor.forClass(ConversionRecord.class);
        verify(conversionRepository).save(captor.capture());
        ConversionRecord saved = captor.getValue();
        assertEquals("c1", saved.getConversionId());
        assertEquals(ConversionType.XML, saved.getConversionType());
        assertEquals("<a/>", saved.getSourceData());
        assertEquals(ConversionStatus.PENDING, saved.getStatus());
        assertNotNull(saved.getCreatedAt());
        assertEquals(saved.getCreatedAt(), saved.getUpdatedAt());
    }

    @Test
    public void testUpdateConversionStatus_NotFound() {
        when(conversionRepository.findByConversionId("missing")).thenReturn(Optional.empty());

        assertThrows(ConversionNotFoundException.class,
                () -> store.updateConversionStatus("missing", ConversionStatus.PROCESSING, null, null));
        verify(conversionRepository, never()).save(any(ConversionRecord.class));
    }

    @Test
    public void testUpdateConversionStatus_EmptyValuesKeepStoredOnes() {
        ConversionRecord record = conversion("c1");
        record.setConvertedData(new LinkedHashMap<>(Map.of("drug_records_count", 2)));
        record.setErrorMessage("earlier");
        when(conversionRepository.findByConversionId("c1")).thenReturn(Optional.of(record));

        store.updateConversionStatus("c1", ConversionStatus.FAILED, Map.of(), "");

        assertEquals(ConversionStatus.FAILED, record.getStatus());
        assertEquals(2, record.getConvertedData().get("drug_records_count"));
        assertEquals("earlier", record.getErrorMessage());
        assertNotNull(record.getUpdatedAt());
        verify(conversionRepository).save(record);
    }

    @Test
    public void testUpdateConversionStatus_StoresPayload() {
        ConversionRecord record = conversion("c1");
        when(conversionRepository.findByConversionId("c1")).thenReturn(Optional.of(record));

        store.updateConversionStatus("c1", ConversionStatus.COMPLETED, Map.of("patients_count", 1), null);

        assertEquals(ConversionStatus.COMPLETED, record.getStatus());
        assertEquals(Map.of("patients_count", 1), record.getConvertedData());
        assertNull(record.getErrorMessage());
    }

    @Test
    public void testFindConversion() {
        when(conversionRepository.findByConversionId("c1")).thenReturn(Optional.of(conversion("c1")));
        when(conversionRepository.findByConversionId("c2")).thenReturn(Optional.empty());

        ConversionSnapshot snapshot = store.findConversion("c1").orElseThrow();
        assertEquals("c1", snapshot.getConversionId());
        assertEquals(ConversionType.HL7, snapshot.getConversionType());
        assertEquals("MSH|...", snapshot.getSourceData());
        assertEquals(ConversionStatus.PENDING, snapshot.getStatus());
        assertTrue(store.findConversion("c2").isEmpty());
    }

    @Test
    public void testGetOrCreatePatient_Unresolved() {
        assertTrue(store.getOrCreatePatient(NormalizedPatient.builder().fullName("Nobody").build()).isEmpty());
        verifyNoInteractions(patientRepository);
    }

    @Test
    public void testGetOrCreatePatient_New() {
        when(patientRepository.findByPatientId("PAT001")).thenReturn(Optional.empty());
        when(patientRepository.save(any(PatientRecord.class))).thenAnswer(invocation -> {
            PatientRecord record = invocation.getArgument(0);
            record.setId("p-1");
            return record;
        });

        NormalizedPatient patient = NormalizedPatient.builder()
                .patientId("PAT001")
                .fullName("JOHN DOE")
                .dateOfBirth("1980-01-01")
                .metadataEntry("source_segment", "PID")
                .build();

        assertEquals(Optional.of("p-1"), store.getOrCreatePatient(patient));

        ArgumentCaptor<PatientRecord> captor = ArgumentCaptor.forClass(PatientRecord.class);
        verify(patientRepository).save(captor.capture());
        assertEquals("1980-01-01", captor.getValue().getDateOfBirth());
        assertEquals("PID", captor.getValue().getMetadata().get("source_segment"));
    }

    @Test
    public void testGetOrCreatePatient_MergesNonEmptyValues() {
        PatientRecord existing = storedPatient("p-1", "PAT001");
        when(patientRepository.findByPatientId("PAT001")).thenReturn(Optional.of(existing));

        NormalizedPatient patient = NormalizedPatient.builder()
                .patientId("PAT001")
                .fullName("JOHN DOE")
                .phoneNumber("(555)555-5555")
                .age(44)
                .build();

        assertEquals(Optional.of("p-1"), store.getOrCreatePatient(patient));
        assertEquals("(555)555-5555", existing.getPhoneNumber());
        assertEquals(44, existing.getAge());
        assertEquals("123 MAIN ST", existing.getAddress());
        assertEquals("M", existing.getGender());
        verify(patientRepository).save(existing);
    }

    @Test
    public void testGetOrCreatePatient_UnchangedIsNotSaved() {
        PatientRecord existing = storedPatient("p-1", "PAT001");
        when(patientRepository.findByPatientId("PAT001")).thenReturn(Optional.of(existing));

        NormalizedPatient patient = NormalizedPatient.builder()
                .patientId("PAT001")
                .fullName("JOHN DOE")
                .build();

        assertEquals(Optional.of("p-1"), store.getOrCreatePatient(patient));
        verify(patientRepository, never()).save(any(PatientRecord.class));
    }

    @Test
    public void testCreateDrugRecords_LinksStoredPatients() {
        when(conversionRepository.findByConversionId("c1")).thenReturn(Optional.of(conversion("c1")));
        when(patientRepository.findByPatientId("PAT001")).thenReturn(Optional.of(storedPatient("p-1", "PAT001")));
        when(drugRecordRepository.saveAll(anyList())).thenAnswer(invocation -> {
            List<DrugRecord> records = invocation.getArgument(0);
            for (int i = 0; i < records.size(); i++) {
                records.get(i).setId("d-" + (i + 1));
            }
            return records;
        });

        ExtractionResult result = ExtractionResult.builder()
                .patient(NormalizedPatient.builder().patientId("PAT001").build())
                .drugRecord(NormalizedDrugFact.builder()
                        .drugName("Aspirin").strength("81MG").quantity(30).patientId("PAT001")
                        .prescriptionId("ORD001").metadataEntry("segment_type", "RXE").build())
                .drugRecord(NormalizedDrugFact.builder()
                        .drugName("Lisinopril").patientId("OTHER").build())
                .build();

        List<String> ids = store.createDrugRecords("c1", result);

        assertEquals(List.of("d-1", "d-2"), ids);
        verify(drugRecordRepository).saveAll(drugRecordsCaptor.capture());
        List<DrugRecord> saved = drugRecordsCaptor.getValue();
        assertEquals(2, saved.size());

        DrugRecord aspirin = saved.get(0);
        assertEquals("c1", aspirin.getConversionId());
        assertEquals("p-1", aspirin.getPatientRecordId());
        assertEquals("PAT001", aspirin.getOriginalPatientId());
        assertEquals(30, aspirin.getQuantity());
        assertEquals("ORD001", aspirin.getPrescriptionId());
        assertEquals("RXE", aspirin.getMetadata().get("segment_type"));

        DrugRecord lisinopril = saved.get(1);
        assertNull(lisinopril.getPatientRecordId());
        assertEquals("OTHER", lisinopril.getOriginalPatientId());
    }

    @Test
    public void testCreateDrugRecords_UnknownConversion() {
        when(conversionRepository.findByConversionId("missing")).thenReturn(Optional.empty());

        assertThrows(ConversionNotFoundException.class,
                () -> store.createDrugRecords("missing", ExtractionResult.empty()));
        verifyNoInteractions(drugRecordRepository);
    }

    @Test
    public void testCountDrugRecords() {
        when(drugRecordRepository.countByConversionId("c1")).thenReturn(3L);

        assertEquals(3L, store.countDrugRecords("c1"));
    }

    @Test
    public void testDeleteDrugRecords() {
        when(drugRecordRepository.deleteByConversionId("c1")).thenReturn(2L);

        store.deleteDrugRecords("c1");

        verify(drugRecordRepository).deleteByConversionId("c1");
    }
}
