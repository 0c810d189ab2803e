package com.al.clinicalconverter.parser.hl7;

import com.al.clinicalconverter.exception.MessageParseException;
import com.al.clinicalconverter.model.hl7.Hl7MessageType;
import com.al.clinicalconverter.model.hl7.ParsedMessage;
import com.al.clinicalconverter.model.hl7.ParsedSegment;
import com.al.clinicalconverter.model.value.Repeated;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.al.clinicalconverter.util.MappingConstants.SEGMENT_MSH;

/**
 * Aggregates decomposed segments into a {@link ParsedMessage}.
 */
@Slf4j
@Component
public class Hl7MessageBuilder {

    private final Hl7FieldDecomposer decomposer;

    public Hl7MessageBuilder(Hl7FieldDecomposer decomposer) {
        this.decomposer = decomposer;
    }

    /**
     * @param segments tokenized segments, MSH first
     * @throws MessageParseException when there are no segments or the first
     *                               one is not MSH
     */
    public ParsedMessage buildMessage(List<String> segments) {
        if (segments == null || segments.isEmpty()) {
            throw new MessageParseException("No segments found in HL7 message");
        }
        String header = segments.get(0);
        if (!header.startsWith(SEGMENT_MSH)) {
            throw new MessageParseException("First segment must be " + SEGMENT_MSH + " but was: "
                    + header.substring(0, Math.min(3, header.length())));
        }

        Hl7MessageType messageType = decomposer.extractMessageType(header);
        Map<String, Repeated<ParsedSegment>> bySegmentName = new LinkedHashMap<>();
        for (String segment : segments) {
            ParsedSegment parsed = decomposer.decomposeSegment(segment);
            String name = segment.substring(0, Math.min(3, segment.length()));
            bySegmentName.merge(name, Repeated.one(parsed),
                    (existing, added) -> existing.append(added.first()));
        }

        log.debug("Built {}^{} message with segments {}", messageType.getMessageType(),
                messageType.getTriggerEvent(), bySegmentName.keySet());
        return new ParsedMessage(messageType, bySegmentName);
    }
}
