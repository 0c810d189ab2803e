package com.al.clinicalconverter.model.hl7;

import com.al.clinicalconverter.model.value.Repeated;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Message-level HL7 model: the MSH message type plus every segment keyed by
 * name in first-seen order. A name seen once maps to a single segment; a
 * repeated name maps to all occurrences in source order.
 */
@Getter
@EqualsAndHashCode
@ToString
public class ParsedMessage {

    private final Hl7MessageType messageType;
    private final Map<String, Repeated<ParsedSegment>> segments;

    public ParsedMessage(Hl7MessageType messageType, Map<String, Repeated<ParsedSegment>> segments) {
        this.messageType = messageType;
        this.segments = Collections.unmodifiableMap(new LinkedHashMap<>(segments));
    }

    public Optional<Repeated<ParsedSegment>> segment(String name) {
        return Optional.ofNullable(segments.get(name));
    }

    /**
     * All occurrences of {@code name}; empty when the message has none.
     */
    public List<ParsedSegment> segments(String name) {
        return segment(name).map(Repeated::asList).orElse(Collections.emptyList());
    }

    public Optional<ParsedSegment> firstSegment(String name) {
        return segment(name).map(Repeated::first);
    }

    public boolean hasSegment(String name) {
        return segments.containsKey(name);
    }
}
