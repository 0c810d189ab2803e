package com.al.clinicalconverter.parser.hl7.converter;

import com.al.clinicalconverter.model.NormalizedPatient;
import com.al.clinicalconverter.model.hl7.ParsedMessage;
import com.al.clinicalconverter.model.hl7.ParsedSegment;
import com.al.clinicalconverter.model.value.Value;
import com.al.clinicalconverter.parser.hl7.Hl7FieldDecomposer;
import com.al.clinicalconverter.util.Hl7DateUtil;
import com.al.clinicalconverter.util.ValueParsers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.al.clinicalconverter.util.MappingConstants.META_SOURCE_FORMAT;
import static com.al.clinicalconverter.util.MappingConstants.META_SOURCE_SEGMENT;
import static com.al.clinicalconverter.util.MappingConstants.PV1_DATE_OF_BIRTH;
import static com.al.clinicalconverter.util.MappingConstants.PV1_PATIENT_ID;
import static com.al.clinicalconverter.util.MappingConstants.PV1_PATIENT_NAME;
import static com.al.clinicalconverter.util.MappingConstants.SEGMENT_PID;
import static com.al.clinicalconverter.util.MappingConstants.SEGMENT_PV1;

/**
 * Resolves the single patient of an HL7 message.
 *
 * <p>
 * Sources are tried in order, first hit wins:
 * <ol>
 * <li>the first PID segment</li>
 * <li>PID data embedded in the raw text of the first segment (only when the
 * message has no PID segment at all)</li>
 * <li>the PV1 visit number, with placeholder name and birth date</li>
 * </ol>
 * A message with none of these yields no patient.
 */
@Component
@Slf4j
public class PatientConverter implements SegmentConverter<NormalizedPatient> {

    static final String SOURCE_PID = "PID";
    static final String SOURCE_PID_EMBEDDED = "PID_EMBEDDED";
    static final String SOURCE_PV1 = "PV1";

    private static final Pattern EMBEDDED_PID = Pattern.compile("\\|PID\\|(.+?)(?=\\|[A-Z]{3}\\||$)");
    // set id through sex
    private static final int EMBEDDED_PID_MIN_FIELDS = 8;

    // PID field positions
    private static final int PID_INTERNAL_ID = 3;
    private static final int PID_EXTERNAL_ID = 2;
    private static final int PID_NAME = 5;
    private static final int PID_BIRTH_DATE = 7;
    private static final int PID_SEX = 8;
    private static final int PID_ADDRESS = 11;
    private static final int PID_HOME_PHONE = 13;
    private static final int PID_BUSINESS_PHONE = 14;

    // PV1 field positions
    private static final int PV1_VISIT_NUMBER = 19;
    private static final int PV1_ALTERNATE_VISIT_ID = 20;

    private final Hl7FieldDecomposer decomposer;

    public PatientConverter(Hl7FieldDecomposer decomposer) {
        this.decomposer = decomposer;
    }

    @Override
    public List<NormalizedPatient> convert(ParsedMessage message, ConversionContext context) {
        Optional<NormalizedPatient> patient = message.firstSegment(SEGMENT_PID).map(this::fromPid);
        if (patient.isEmpty()) {
            patient = fromEmbeddedPid(context.getRawSegments());
        }
        if (patient.isEmpty() || !patient.get().isResolved()) {
            Optional<NormalizedPatient> visitPatient = message.firstSegment(SEGMENT_PV1).map(this::fromPv1);
            if (visitPatient.isPresent()) {
                patient = visitPatient;
            }
        }

        if (patient.isEmpty() || !patient.get().isResolved()) {
            log.debug("No patient could be resolved from message");
            return List.of();
        }
        log.debug("Resolved patient {} from {}", patient.get().getPatientId(),
                patient.get().getMetadata().get(META_SOURCE_SEGMENT));
        return List.of(patient.get());
    }

    private NormalizedPatient fromPid(ParsedSegment pid) {
        String patientId = pid.firstComponentText(PID_INTERNAL_ID)
                .or(() -> pid.firstComponentText(PID_EXTERNAL_ID))
                .orElse("");

        NormalizedPatient.NormalizedPatientBuilder builder = NormalizedPatient.builder()
                .patientId(patientId)
                .dateOfBirth(pid.firstComponentText(PID_BIRTH_DATE).flatMap(Hl7DateUtil::parseHl7Date).orElse(""))
                .gender(pid.firstComponentText(PID_SEX).orElse(""))
                .address(pid.field(PID_ADDRESS).map(PatientConverter::formatAddress).orElse(""))
                .phoneNumber(ValueParsers.firstNonEmpty(
                        pid.fieldText(PID_HOME_PHONE).orElse(""),
                        pid.fieldText(PID_BUSINESS_PHONE).orElse("")))
                .metadataEntry(META_SOURCE_FORMAT, "HL7")
                .metadataEntry(META_SOURCE_SEGMENT, SOURCE_PID);
        pid.field(PID_NAME).ifPresent(name -> applyName(builder, name));
        return builder.build();
    }

    /**
     * Some feeds flatten the whole message onto one line with PID data
     * trailing the header; pull it out of the raw text.
     */
    private Optional<NormalizedPatient> fromEmbeddedPid(List<String> rawSegments) {
        if (rawSegments == null || rawSegments.isEmpty()) {
            return Optional.empty();
        }
        String first = rawSegments.get(0);
        if (!first.contains("|PID|")) {
            return Optional.empty();
        }
        Matcher matcher = EMBEDDED_PID.matcher(first);
        if (!matcher.find()) {
            return Optional.empty();
        }

        String[] elements = matcher.group(1).split("\\|", -1);
        if (elements.length < EMBEDDED_PID_MIN_FIELDS) {
            log.debug("Embedded PID has {} field(s), too short to read", elements.length);
            return Optional.empty();
        }
        NormalizedPatient.NormalizedPatientBuilder builder = NormalizedPatient.builder()
                .patientId(leadingText(elements, 2))
                .dateOfBirth(Hl7DateUtil.parseHl7Date(leadingText(elements, 6)).orElse(""))
                .gender(leadingText(elements, 7))
                .metadataEntry(META_SOURCE_FORMAT, "HL7")
                .metadataEntry(META_SOURCE_SEGMENT, SOURCE_PID_EMBEDDED);
        if (elements.length > 4 && !elements[4].isEmpty()) {
            applyName(builder, decomposer.decomposeField(elements[4]));
        }
        log.warn("Patient recovered from PID data embedded in the {} segment",
                first.substring(0, Math.min(3, first.length())));
        return Optional.of(builder.build());
    }

    private NormalizedPatient fromPv1(ParsedSegment pv1) {
        String patientId = pv1.firstComponentText(PV1_VISIT_NUMBER).orElse("");
        Optional<Value> alternate = pv1.field(PV1_ALTERNATE_VISIT_ID).filter(Value::isComposite);
        if (alternate.isPresent() && !alternate.get().componentText(0).isEmpty()) {
            patientId = alternate.get().componentText(0);
        }
        return NormalizedPatient.builder()
                .patientId(patientId.isEmpty() ? PV1_PATIENT_ID : patientId)
                .fullName(PV1_PATIENT_NAME)
                .dateOfBirth(PV1_DATE_OF_BIRTH)
                .metadataEntry(META_SOURCE_FORMAT, "HL7")
                .metadataEntry(META_SOURCE_SEGMENT, SOURCE_PV1)
                .build();
    }

    /**
     * XPN: family name in component 0, given name in component 1. A name
     * without components is used as the full name.
     */
    private static void applyName(NormalizedPatient.NormalizedPatientBuilder builder, Value name) {
        if (name.isComposite()) {
            String lastName = name.componentText(0);
            String firstName = name.componentText(1);
            builder.lastName(lastName)
                    .firstName(firstName)
                    .fullName((firstName + " " + lastName).trim());
        } else {
            builder.fullName(name.asText());
        }
    }

    /**
     * XAD: street, other designation, city, state joined with ", ".
     */
    private static String formatAddress(Value address) {
        if (!address.isComposite()) {
            return address.asText();
        }
        List<String> parts = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            String part = address.componentText(i);
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }
        return String.join(", ", parts);
    }

    private String leadingText(String[] elements, int index) {
        if (index >= elements.length || elements[index].isEmpty()) {
            return "";
        }
        return decomposer.decomposeField(elements[index]).leadingText();
    }
}
