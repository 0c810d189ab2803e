package com.al.clinicalconverter.service;

import com.al.clinicalconverter.ParserFixtures;
import com.al.clinicalconverter.model.NormalizedDrugFact;
import com.al.clinicalconverter.model.enums.ConversionType;
import com.al.clinicalconverter.parser.xml.XmlTreeNormalizer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ConversionDataValidatorTest {

    private final ConversionDataValidator validator = new ConversionDataValidator(new XmlTreeNormalizer(),
            ParserFixtures.tokenizer());

    @Test
    public void testValidHl7() {
        assertTrue(validator.validate(ConversionType.HL7, ParserFixtures.sample("orm_o01_rxe.hl7")).isEmpty());
        assertTrue(validator.validate(ConversionType.HL7, ParserFixtures.sample("vxu_v04_embedded_pid.hl7"))
                .isEmpty());
    }

    @Test
    public void testInvalidHl7() {
        List<String> errors = validator.validate(ConversionType.HL7, "Invalid HL7 data");

        assertEquals(List.of("HL7 message must start with MSH segment",
                "Segment 1 must contain field separators (|)"), errors);
    }

    @Test
    public void testHl7SegmentWithoutSeparators() {
        List<String> errors = validator.validateHl7("MSH|^~\\&|App\rNOTE");

        assertEquals(List.of("Segment 2 must contain field separators (|)"), errors);
    }

    @Test
    public void testEmptyInput() {
        assertEquals(List.of("HL7 data cannot be empty"), validator.validate(ConversionType.HL7, " "));
        assertEquals(List.of("XML data cannot be empty"), validator.validate(ConversionType.XML, null));
        assertEquals(List.of("Conversion type is required"), validator.validate(null, "<a/>"));
    }

    @Test
    public void testXml() {
        assertTrue(validator.validate(ConversionType.XML, ParserFixtures.sample("prescription.xml")).isEmpty());

        List<String> errors = validator.validate(ConversionType.XML, "<invalid>xml");
        assertEquals(1, errors.size());
        assertTrue(errors.get(0).startsWith("Invalid XML data"));
    }

    @Test
    public void testDrugFact() {
        NormalizedDrugFact bad = NormalizedDrugFact.builder().drugName("").quantity(-1).build();
        assertEquals(List.of("Drug name is required", "Quantity must be non-negative"),
                validator.validateDrugFact(bad));

        NormalizedDrugFact good = NormalizedDrugFact.builder().drugName("Aspirin").quantity(30).build();
        assertTrue(validator.validateDrugFact(good).isEmpty());
    }
}
