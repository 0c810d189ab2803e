package com.al.clinicalconverter.parser.hl7.converter;

import com.al.clinicalconverter.model.NormalizedDrugFact;
import com.al.clinicalconverter.model.hl7.ParsedMessage;
import com.al.clinicalconverter.model.hl7.ParsedSegment;
import com.al.clinicalconverter.model.hl7.PrescriptionInfo;
import com.al.clinicalconverter.util.ValueParsers;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

import static com.al.clinicalconverter.util.MappingConstants.META_FILLER_ORDER_NUMBER;
import static com.al.clinicalconverter.util.MappingConstants.META_ORDER_CONTROL;
import static com.al.clinicalconverter.util.MappingConstants.META_ORDER_STATUS;
import static com.al.clinicalconverter.util.MappingConstants.META_PATIENT_SOURCE;
import static com.al.clinicalconverter.util.MappingConstants.META_QUANTITY_TIMING;
import static com.al.clinicalconverter.util.MappingConstants.META_SEGMENT_TYPE;
import static com.al.clinicalconverter.util.MappingConstants.META_SOURCE_FORMAT;
import static com.al.clinicalconverter.util.MappingConstants.META_SOURCE_SEGMENT;

/**
 * Shared loop for the drug segment families (RXA, RXE).
 *
 * <p>
 * The i-th segment of the family is paired with the i-th ORC in
 * {@link ConversionContext#getPrescriptions()} before facts without a drug
 * name are dropped, so a nameless segment still consumes its ORC.
 */
@Slf4j
public abstract class AbstractDrugConverter implements SegmentConverter<NormalizedDrugFact> {

    /**
     * Segment name this converter reads, e.g. {@code RXA}.
     */
    protected abstract String segmentName();

    /**
     * Reads the drug columns of one segment. Patient and order details are
     * filled in afterwards.
     */
    protected abstract NormalizedDrugFact.NormalizedDrugFactBuilder readSegment(ParsedSegment segment);

    @Override
    public List<NormalizedDrugFact> convert(ParsedMessage message, ConversionContext context) {
        List<ParsedSegment> segments = message.segments(segmentName());
        List<PrescriptionInfo> prescriptions = context.getPrescriptions();
        String patientId = context.getPatient().getPatientId();
        String patientSource = context.getPatient().getMetadata().getOrDefault(META_SOURCE_SEGMENT, "");

        List<NormalizedDrugFact> facts = new ArrayList<>();
        for (int i = 0; i < segments.size(); i++) {
            NormalizedDrugFact.NormalizedDrugFactBuilder builder = readSegment(segments.get(i))
                    .patientId(patientId)
                    .metadataEntry(META_SOURCE_FORMAT, "HL7")
                    .metadataEntry(META_SEGMENT_TYPE, segmentName());
            if (!patientSource.isEmpty()) {
                builder.metadataEntry(META_PATIENT_SOURCE, patientSource);
            }
            if (i < prescriptions.size()) {
                applyPrescription(builder, prescriptions.get(i));
            }

            NormalizedDrugFact fact = builder.build();
            if (fact.hasDrugName()) {
                facts.add(fact);
            } else {
                log.debug("Dropping {} segment {} without a drug name", segmentName(), i + 1);
            }
        }
        return facts;
    }

    private static void applyPrescription(NormalizedDrugFact.NormalizedDrugFactBuilder builder,
            PrescriptionInfo prescription) {
        builder.prescriptionId(prescription.getPrescriptionId());
        putIfNotEmpty(builder, META_ORDER_CONTROL, prescription.getOrderControl());
        putIfNotEmpty(builder, META_FILLER_ORDER_NUMBER, prescription.getFillerOrderNumber());
        putIfNotEmpty(builder, META_ORDER_STATUS, prescription.getOrderStatus());
        putIfNotEmpty(builder, META_QUANTITY_TIMING, prescription.getQuantityTiming());
    }

    protected static void putIfNotEmpty(NormalizedDrugFact.NormalizedDrugFactBuilder builder, String key,
            String value) {
        if (value != null && !value.isEmpty()) {
            builder.metadataEntry(key, value);
        }
    }

    protected Integer parseQuantity(String value) {
        Integer quantity = ValueParsers.parseQuantity(value);
        if (quantity == null && value != null && !value.isBlank()) {
            log.debug("{} quantity '{}' is not a whole number", segmentName(), value);
        }
        return quantity;
    }
}
