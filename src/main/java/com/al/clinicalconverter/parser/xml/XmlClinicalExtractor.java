package com.al.clinicalconverter.parser.xml;

import com.al.clinicalconverter.exception.MessageParseException;
import com.al.clinicalconverter.model.ExtractionResult;
import com.al.clinicalconverter.model.NormalizedDrugFact;
import com.al.clinicalconverter.model.NormalizedPatient;
import com.al.clinicalconverter.model.value.Repeated;
import com.al.clinicalconverter.model.value.Value;
import com.al.clinicalconverter.util.ValueParsers;
import com.al.clinicalconverter.util.ValueTrees;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.al.clinicalconverter.util.MappingConstants.META_PRESCRIPTION_PREFIX;
import static com.al.clinicalconverter.util.MappingConstants.META_SOURCE_FORMAT;

/**
 * Finds patient and drug facts in a normalized XML tree.
 *
 * <p>
 * Two passes run and their results are concatenated:
 * <ol>
 * <li>a heuristic scan that recognizes drug-like mappings anywhere in the
 * tree</li>
 * <li>a walk of the {@code prescription(s)} layout:
 *
 * <pre>
 * &lt;prescription&gt;
 *   &lt;patient&gt;&lt;id/&gt;&lt;name/&gt;...&lt;/patient&gt;
 *   &lt;medications&gt;&lt;medication&gt;...&lt;/medication&gt;&lt;/medications&gt;
 * &lt;/prescription&gt;
 * </pre>
 *
 * </li>
 * </ol>
 * The same medication may be reported by both passes.
 */
@Slf4j
@Service
public class XmlClinicalExtractor {

    private static final List<String> DRUG_FIELDS = List.of("name", "dosage", "strength", "quantity");
    private static final List<String> DRUG_KEYWORDS = List.of("drug", "medication", "medicine");

    private static final String PRESCRIPTIONS = "prescriptions";
    private static final String PRESCRIPTION = "prescription";
    private static final String PATIENT = "patient";
    private static final String PATIENT_ID = "patient_id";
    private static final String MEDICATION = "medication";
    private static final String MEDICATIONS = "medications";

    private final ObjectMapper objectMapper;

    public XmlClinicalExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ExtractionResult extract(Value tree) {
        Value.Mapping root = tree.asMapping().orElse(Value.emptyMapping());

        List<NormalizedDrugFact> heuristicDrugs = new ArrayList<>();
        scanForDrugs(root, heuristicDrugs);

        ExtractionResult.ExtractionResultBuilder schema = ExtractionResult.builder();
        for (Value.Mapping prescription : prescriptions(root)) {
            walkPrescription(prescription, schema);
        }

        ExtractionResult result = ExtractionResult.builder()
                .drugRecords(dropUnnamed(heuristicDrugs))
                .build()
                .concat(schema.build());
        log.debug("Extracted {} patient(s) and {} drug record(s) from XML ({} by heuristic scan)",
                result.getPatients().size(), result.getDrugRecords().size(), heuristicDrugs.size());
        return result;
    }

    // ========================================================================
    // Heuristic scan
    // ========================================================================

    private void scanForDrugs(Value.Mapping mapping, List<NormalizedDrugFact> found) {
        for (Map.Entry<String, Repeated<Value>> entry : mapping.getEntries().entrySet()) {
            Repeated<Value> repeated = entry.getValue();
            if (repeated.isRepeated()) {
                // items are walked, never classified themselves
                for (Value item : repeated.asList()) {
                    item.asMapping().ifPresent(m -> scanForDrugs(m, found));
                }
                continue;
            }
            Value value = repeated.first();
            if (!value.isMapping()) {
                continue;
            }
            Value.Mapping child = (Value.Mapping) value;
            if (looksLikeDrug(child)) {
                found.add(normalizeDrug(child, null, null));
            } else {
                scanForDrugs(child, found);
            }
        }
    }

    boolean looksLikeDrug(Value.Mapping mapping) {
        boolean hasDrugField = DRUG_FIELDS.stream().anyMatch(mapping::containsKey);
        if (!hasDrugField || mapping.containsKey(PATIENT_ID)) {
            return false;
        }
        String text = serialize(mapping).toLowerCase(Locale.ROOT);
        return DRUG_KEYWORDS.stream().anyMatch(text::contains);
    }

    private String serialize(Value.Mapping mapping) {
        try {
            return objectMapper.writeValueAsString(ValueTrees.toPlain(mapping));
        } catch (JsonProcessingException e) {
            throw new MessageParseException("XML parsing error: " + e.getOriginalMessage(), e);
        }
    }

    // ========================================================================
    // Prescription layout
    // ========================================================================

    private List<Value.Mapping> prescriptions(Value.Mapping root) {
        if (root.containsKey(PRESCRIPTIONS)) {
            return root.first(PRESCRIPTIONS)
                    .flatMap(Value::asMapping)
                    .map(wrapper -> mappings(wrapper, PRESCRIPTION))
                    .orElse(Collections.emptyList());
        }
        return mappings(root, PRESCRIPTION);
    }

    private void walkPrescription(Value.Mapping prescription, ExtractionResult.ExtractionResultBuilder result) {
        Value.Mapping patient = prescription.first(PATIENT)
                .flatMap(Value::asMapping)
                .orElse(Value.emptyMapping());

        if (!patient.isEmpty()) {
            NormalizedPatient normalized = normalizePatient(patient);
            if (normalized.isResolved()) {
                result.patient(normalized);
            } else {
                log.debug("Skipping prescription patient without an id");
            }
        }

        List<Value.Mapping> medications = new ArrayList<>(mappings(prescription, MEDICATION));
        prescription.first(MEDICATIONS)
                .flatMap(Value::asMapping)
                .ifPresent(wrapper -> medications.addAll(mappings(wrapper, MEDICATION)));

        for (Value.Mapping medication : medications) {
            NormalizedDrugFact drug = normalizeDrug(medication, patient, prescription);
            if (drug.hasDrugName()) {
                result.drugRecord(drug);
            }
        }
    }

    /**
     * Every mapping stored under {@code key}, in document order.
     */
    private static List<Value.Mapping> mappings(Value.Mapping parent, String key) {
        List<Value.Mapping> found = new ArrayList<>();
        parent.get(key).ifPresent(repeated -> repeated.asList()
                .forEach(item -> item.asMapping().ifPresent(found::add)));
        return found;
    }

    // ========================================================================
    // Normalization
    // ========================================================================

    NormalizedDrugFact normalizeDrug(Value.Mapping data, Value.Mapping patient, Value.Mapping prescription) {
        String siblingPatientId = patient == null ? "" : patient.text("id");

        NormalizedDrugFact.NormalizedDrugFactBuilder builder = NormalizedDrugFact.builder()
                .drugName(ValueParsers.firstNonEmpty(data.text("name"), data.text("drug_name"),
                        data.text("medication_name")))
                .dosage(ValueParsers.firstNonEmpty(data.text("dosage"), data.text("dose")))
                .strength(ValueParsers.firstNonEmpty(data.text("strength"), data.text("potency")))
                .quantity(ValueParsers.parseQuantity(data.text("quantity")))
                .patientId(ValueParsers.firstNonEmpty(data.text(PATIENT_ID), siblingPatientId))
                .prescriptionId(ValueParsers.firstNonEmpty(data.text("prescription_id"), data.text("id")))
                .metadataEntry(META_SOURCE_FORMAT, "XML");

        if (prescription != null) {
            prescription.getEntries().forEach((key, value) -> {
                if (!value.isRepeated() && value.first().isPrimitive()) {
                    builder.metadataEntry(META_PRESCRIPTION_PREFIX + key, value.first().asText());
                }
            });
        }
        return builder.build();
    }

    NormalizedPatient normalizePatient(Value.Mapping patient) {
        String name = patient.text("name");
        String firstName = "";
        String lastName = "";
        int space = name.indexOf(' ');
        if (space >= 0) {
            firstName = name.substring(0, space);
            lastName = name.substring(space + 1);
        }

        return NormalizedPatient.builder()
                .patientId(patient.text("id"))
                .firstName(firstName)
                .lastName(lastName)
                .fullName(name)
                .age(ValueParsers.parseInteger(patient.text("age")))
                .gender(patient.text("gender"))
                .address(patient.text("address"))
                .phoneNumber(patient.text("phone"))
                .metadataEntry(META_SOURCE_FORMAT, "XML")
                .build();
    }

    private static List<NormalizedDrugFact> dropUnnamed(List<NormalizedDrugFact> drugs) {
        List<NormalizedDrugFact> named = new ArrayList<>();
        for (NormalizedDrugFact drug : drugs) {
            if (drug.hasDrugName()) {
                named.add(drug);
            }
        }
        return named;
    }
}
