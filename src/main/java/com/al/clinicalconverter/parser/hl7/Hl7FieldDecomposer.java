package com.al.clinicalconverter.parser.hl7;

import com.al.clinicalconverter.model.hl7.Hl7MessageType;
import com.al.clinicalconverter.model.hl7.ParsedSegment;
import com.al.clinicalconverter.model.value.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static com.al.clinicalconverter.util.MappingConstants.COMPONENT_DELIMITER;
import static com.al.clinicalconverter.util.MappingConstants.SUBCOMPONENT_DELIMITER;

/**
 * Decomposes one HL7 segment string into its name and positional fields.
 *
 * <pre>
 * RXA|0|1|20150202||20^DTaP^CVX|.5
 *   name = RXA
 *   1 = Primitive(0), 2 = Primitive(1), 3 = Primitive(20150202)
 *   5 = Composite[Primitive(20), Primitive(DTaP), Primitive(CVX)]
 *   6 = Primitive(.5)
 * </pre>
 *
 * A field with {@code ^} becomes a composite of components; a component with
 * {@code &} becomes a composite of sub-components. Empty fields are skipped.
 */
@Component
public class Hl7FieldDecomposer {

    private static final Pattern FIELD_SPLIT = Pattern.compile("\\|");
    private static final Pattern COMPONENT_SPLIT = Pattern.compile(Pattern.quote(String.valueOf(COMPONENT_DELIMITER)));
    private static final Pattern SUBCOMPONENT_SPLIT = Pattern.compile(Pattern.quote(String.valueOf(SUBCOMPONENT_DELIMITER)));

    // MSH-9 sits at split position 8 because MSH-1 is the separator itself
    private static final int MSH_MESSAGE_TYPE_POSITION = 8;

    public ParsedSegment decomposeSegment(String segment) {
        String[] raw = FIELD_SPLIT.split(segment, -1);
        Map<Integer, Value> fields = new LinkedHashMap<>();
        for (int i = 1; i < raw.length; i++) {
            if (!raw[i].isEmpty()) {
                fields.put(i, decomposeField(raw[i]));
            }
        }
        return new ParsedSegment(raw[0], fields);
    }

    public Value decomposeField(String field) {
        if (field.indexOf(COMPONENT_DELIMITER) < 0) {
            return Value.primitive(field);
        }
        List<Value> components = new ArrayList<>();
        for (String component : COMPONENT_SPLIT.split(field, -1)) {
            components.add(decomposeComponent(component));
        }
        return Value.composite(components, COMPONENT_DELIMITER);
    }

    private Value decomposeComponent(String component) {
        if (component.indexOf(SUBCOMPONENT_DELIMITER) < 0) {
            return Value.primitive(component);
        }
        List<Value> subcomponents = new ArrayList<>();
        for (String sub : SUBCOMPONENT_SPLIT.split(component, -1)) {
            subcomponents.add(Value.primitive(sub));
        }
        return Value.composite(subcomponents, SUBCOMPONENT_DELIMITER);
    }

    /**
     * Reads MSH-9. {@code VXU^V04^VXU_V04} gives VXU / V04; a primitive
     * value gives the whole value and an empty trigger event.
     */
    public Hl7MessageType extractMessageType(String mshSegment) {
        String[] raw = FIELD_SPLIT.split(mshSegment, -1);
        if (raw.length <= MSH_MESSAGE_TYPE_POSITION) {
            return Hl7MessageType.unknown();
        }
        String typeField = raw[MSH_MESSAGE_TYPE_POSITION];
        if (typeField.indexOf(COMPONENT_DELIMITER) < 0) {
            return new Hl7MessageType(typeField, "");
        }
        String[] components = COMPONENT_SPLIT.split(typeField, -1);
        return new Hl7MessageType(components[0], components.length > 1 ? components[1] : "");
    }
}
