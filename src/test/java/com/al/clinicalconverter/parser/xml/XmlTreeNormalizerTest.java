package com.al.clinicalconverter.parser.xml;

import com.al.clinicalconverter.exception.InvalidFormatException;
import com.al.clinicalconverter.model.enums.ConversionType;
import com.al.clinicalconverter.model.value.Repeated;
import com.al.clinicalconverter.model.value.Value;
import com.al.clinicalconverter.util.ValueTrees;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class XmlTreeNormalizerTest {

    private final XmlTreeNormalizer normalizer = new XmlTreeNormalizer();

    private Value.Mapping root(String xml, String rootTag) {
        Value.Mapping tree = normalizer.normalize(xml).asMapping().orElseThrow();
        assertEquals(1, tree.getEntries().size());
        return tree.first(rootTag).flatMap(Value::asMapping).orElseThrow();
    }

    @Test
    public void testRootTagIsOnlyKey() {
        Value tree = normalizer.normalize("<prescription><drug>A</drug></prescription>");
        assertEquals(Map.of("prescription", Map.of("drug", "A")), ValueTrees.toPlain(tree));
    }

    @Test
    public void testAttributesAreNestedUnderAttributesKey() {
        Value.Mapping patient = root("<patient id=\"P1\" type=\"in\"><name>Jo</name></patient>", "patient");

        Value.Mapping attributes = patient.first("@attributes").flatMap(Value::asMapping).orElseThrow();
        assertEquals("P1", attributes.text("id"));
        assertEquals("in", attributes.text("type"));
        assertEquals("Jo", patient.text("name"));
    }

    @Test
    public void testRepeatedTagsCollapseInDocumentOrder() {
        Value.Mapping prescription = root(
                "<prescription><drug>A</drug><note>x</note><drug>B</drug><drug>C</drug></prescription>",
                "prescription");

        Repeated<Value> drugs = prescription.get("drug").orElseThrow();
        assertTrue(drugs.isRepeated());
        assertEquals(List.of("A", "B", "C"), ValueTrees.toPlain(drugs));
        assertFalse(prescription.get("note").orElseThrow().isRepeated());
        assertEquals(List.of("drug", "note"), List.copyOf(prescription.getEntries().keySet()));
    }

    @Test
    public void testLeafTextWinsOverAttributes() {
        Value.Mapping medication = root("<medication><dose unit=\"mg\"> 5 </dose></medication>", "medication");

        Value dose = medication.first("dose").orElseThrow();
        assertTrue(dose.isPrimitive());
        assertEquals("5", dose.asText());
    }

    @Test
    public void testEmptyLeafBecomesMapping() {
        Value.Mapping prescription = root("<prescription><note/><flag kind=\"x\"></flag></prescription>",
                "prescription");

        Value note = prescription.first("note").orElseThrow();
        assertTrue(note.isMapping());
        assertTrue(note.asMapping().orElseThrow().isEmpty());

        Value.Mapping flag = prescription.first("flag").flatMap(Value::asMapping).orElseThrow();
        assertEquals(Map.of("@attributes", Map.of("kind", "x")), ValueTrees.toPlain(flag));
    }

    @Test
    public void testMalformedXml() {
        assertFalse(normalizer.isWellFormed("<invalid>xml"));

        InvalidFormatException e = assertThrows(InvalidFormatException.class,
                () -> normalizer.normalize("<invalid>xml"));
        assertEquals(ConversionType.XML, e.getFormat());
        assertTrue(e.getMessage().startsWith("Invalid XML data: "));
        assertTrue(e.getMessage().length() > "Invalid XML data: ".length());
    }

    @Test
    public void testEmptyDocument() {
        assertFalse(normalizer.isWellFormed(""));
        assertFalse(normalizer.isWellFormed(null));
        assertThrows(InvalidFormatException.class, () -> normalizer.normalize("   "));
    }

    @Test
    public void testDoctypeIsAccepted() {
        String xml = "<?xml version=\"1.0\"?><!DOCTYPE prescription>"
                + "<prescription><medication><name>Aspirin</name></medication></prescription>";

        assertTrue(normalizer.isWellFormed(xml));
        assertEquals(Map.of("prescription", Map.of("medication", Map.of("name", "Aspirin"))),
                ValueTrees.toPlain(normalizer.normalize(xml)));
    }

    @Test
    public void testExternalEntitiesAreNotResolved() {
        String xml = "<?xml version=\"1.0\"?><!DOCTYPE foo [<!ENTITY xxe SYSTEM \"file:///etc/passwd\">]>"
                + "<foo>&xxe;</foo>";

        String plain;
        try {
            plain = String.valueOf(ValueTrees.toPlain(normalizer.normalize(xml)));
        } catch (InvalidFormatException e) {
            plain = "";
        }
        assertFalse(plain.contains("root:"));
    }

    @Test
    public void testNormalizeIsRepeatable() {
        String xml = "<a><b>1</b><b>2</b><c x=\"y\"/></a>";
        assertEquals(normalizer.normalize(xml), normalizer.normalize(xml));
    }
}
