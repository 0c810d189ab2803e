package com.al.clinicalconverter.model.hl7;

import com.al.clinicalconverter.model.value.Value;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * One decomposed HL7 segment. Field indices are 1-based; the segment name
 * (field 0) is never stored among the fields, nor are empty fields.
 */
@Getter
@EqualsAndHashCode
@ToString
public class ParsedSegment {

    private final String name;
    private final SortedMap<Integer, Value> fields;

    public ParsedSegment(String name, Map<Integer, Value> fields) {
        this.name = name;
        this.fields = Collections.unmodifiableSortedMap(new TreeMap<>(fields));
    }

    /**
     * Field {@code index}, or empty when the source had nothing there.
     */
    public Optional<Value> field(int index) {
        return Optional.ofNullable(fields.get(index));
    }

    /**
     * Full text of field {@code index}, composites re-joined.
     */
    public Optional<String> fieldText(int index) {
        return field(index).map(Value::asText);
    }

    /**
     * Text of the first component of field {@code index} (identifier-like
     * fields such as {@code E46749^^^^MR}).
     */
    public Optional<String> firstComponentText(int index) {
        return field(index).map(Value::leadingText).filter(s -> !s.isEmpty());
    }

    public boolean hasField(int index) {
        return fields.containsKey(index);
    }
}
