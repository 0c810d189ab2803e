package com.al.clinicalconverter.service;

import com.al.clinicalconverter.exception.InvalidFormatException;
import com.al.clinicalconverter.model.NormalizedDrugFact;
import com.al.clinicalconverter.model.enums.ConversionType;
import com.al.clinicalconverter.parser.hl7.SegmentTokenizer;
import com.al.clinicalconverter.parser.xml.XmlTreeNormalizer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

import static com.al.clinicalconverter.util.MappingConstants.FIELD_DELIMITER;
import static com.al.clinicalconverter.util.MappingConstants.SEGMENT_MSH;

/**
 * Lists human-readable problems with submitted input or an extracted drug
 * fact. An empty list means no problems were found.
 */
@Component
public class ConversionDataValidator {

    private final XmlTreeNormalizer xmlTreeNormalizer;
    private final SegmentTokenizer segmentTokenizer;

    public ConversionDataValidator(XmlTreeNormalizer xmlTreeNormalizer, SegmentTokenizer segmentTokenizer) {
        this.xmlTreeNormalizer = xmlTreeNormalizer;
        this.segmentTokenizer = segmentTokenizer;
    }

    public List<String> validate(ConversionType type, String data) {
        if (type == null) {
            return List.of("Conversion type is required");
        }
        switch (type) {
            case XML:
                return validateXml(data);
            case HL7:
                return validateHl7(data);
            default:
                return List.of("Unsupported conversion type: " + type);
        }
    }

    public List<String> validateXml(String data) {
        List<String> errors = new ArrayList<>();
        if (data == null || data.isBlank()) {
            errors.add("XML data cannot be empty");
            return errors;
        }
        try {
            xmlTreeNormalizer.normalize(data);
        } catch (InvalidFormatException e) {
            errors.add(e.getMessage());
        }
        return errors;
    }

    public List<String> validateHl7(String data) {
        List<String> errors = new ArrayList<>();
        if (data == null || data.isBlank()) {
            errors.add("HL7 data cannot be empty");
            return errors;
        }
        List<String> segments = segmentTokenizer.tokenize(data);
        if (segments.isEmpty()) {
            errors.add("HL7 data must contain at least one segment");
            return errors;
        }
        if (!segments.get(0).startsWith(SEGMENT_MSH)) {
            errors.add("HL7 message must start with MSH segment");
        }
        for (int i = 0; i < segments.size(); i++) {
            if (segments.get(i).indexOf(FIELD_DELIMITER) < 0) {
                errors.add("Segment " + (i + 1) + " must contain field separators (|)");
            }
        }
        return errors;
    }

    public List<String> validateDrugFact(NormalizedDrugFact drug) {
        List<String> errors = new ArrayList<>();
        if (!drug.hasDrugName()) {
            errors.add("Drug name is required");
        }
        if (drug.getQuantity() != null && drug.getQuantity() < 0) {
            errors.add("Quantity must be non-negative");
        }
        return errors;
    }
}
