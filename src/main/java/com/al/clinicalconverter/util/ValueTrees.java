package com.al.clinicalconverter.util;

import com.al.clinicalconverter.model.hl7.ParsedMessage;
import com.al.clinicalconverter.model.hl7.ParsedSegment;
import com.al.clinicalconverter.model.value.Repeated;
import com.al.clinicalconverter.model.value.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.al.clinicalconverter.util.MappingConstants.META_MESSAGE_TYPE;
import static com.al.clinicalconverter.util.MappingConstants.META_TRIGGER_EVENT;

/**
 * Converts parsed trees to plain {@code Map}/{@code List}/{@code String}
 * structures for JSON serialization and document storage.
 *
 * @author FHIR Transformer Team
 * @since 2.0.0
 */
public final class ValueTrees {

    private ValueTrees() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    public static Object toPlain(Value value) {
        switch (value.getKind()) {
            case PRIMITIVE:
                return value.asText();
            case COMPOSITE:
                List<Object> parts = new ArrayList<>();
                value.asComposite().ifPresent(c -> c.getParts().forEach(p -> parts.add(toPlain(p))));
                return parts;
            default:
                Map<String, Object> entries = new LinkedHashMap<>();
                value.asMapping().ifPresent(m -> m.getEntries()
                        .forEach((key, repeated) -> entries.put(key, toPlain(repeated))));
                return entries;
        }
    }

    /**
     * A single occurrence becomes the bare value; repeats become a list.
     */
    public static Object toPlain(Repeated<Value> repeated) {
        if (!repeated.isRepeated()) {
            return toPlain(repeated.first());
        }
        List<Object> items = new ArrayList<>();
        for (Value item : repeated.asList()) {
            items.add(toPlain(item));
        }
        return items;
    }

    public static Map<String, Object> toPlain(ParsedMessage message) {
        Map<String, Object> messageType = new LinkedHashMap<>();
        messageType.put(META_MESSAGE_TYPE, message.getMessageType().getMessageType());
        messageType.put(META_TRIGGER_EVENT, message.getMessageType().getTriggerEvent());

        Map<String, Object> segments = new LinkedHashMap<>();
        message.getSegments().forEach((name, repeated) -> {
            if (repeated.isRepeated()) {
                List<Object> items = new ArrayList<>();
                repeated.asList().forEach(segment -> items.add(toPlain(segment)));
                segments.put(name, items);
            } else {
                segments.put(name, toPlain(repeated.first()));
            }
        });

        Map<String, Object> plain = new LinkedHashMap<>();
        plain.put(META_MESSAGE_TYPE, messageType);
        plain.put("segments", segments);
        return plain;
    }

    public static Map<String, Object> toPlain(ParsedSegment segment) {
        Map<String, Object> fields = new LinkedHashMap<>();
        segment.getFields().forEach((index, value) -> fields.put(String.valueOf(index), toPlain(value)));

        Map<String, Object> plain = new LinkedHashMap<>();
        plain.put("segment_name", segment.getName());
        plain.put("fields", fields);
        return plain;
    }
}
