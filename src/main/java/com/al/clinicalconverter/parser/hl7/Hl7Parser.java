package com.al.clinicalconverter.parser.hl7;

import com.al.clinicalconverter.exception.InvalidFormatException;
import com.al.clinicalconverter.exception.MessageParseException;
import com.al.clinicalconverter.model.ExtractionResult;
import com.al.clinicalconverter.model.enums.ConversionType;
import com.al.clinicalconverter.model.hl7.ParsedMessage;
import com.al.clinicalconverter.parser.ClinicalParser;
import com.al.clinicalconverter.util.ValueTrees;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

import static com.al.clinicalconverter.util.MappingConstants.SEGMENT_MSH;

/**
 * HL7 v2 pipe-delimited messages: tokenize, build the message model, extract.
 */
@Slf4j
@Service
public class Hl7Parser implements ClinicalParser<ParsedMessage> {

    private final SegmentTokenizer tokenizer;
    private final Hl7MessageBuilder messageBuilder;
    private final Hl7ClinicalExtractor extractor;

    public Hl7Parser(SegmentTokenizer tokenizer, Hl7MessageBuilder messageBuilder, Hl7ClinicalExtractor extractor) {
        this.tokenizer = tokenizer;
        this.messageBuilder = messageBuilder;
        this.extractor = extractor;
    }

    @Override
    public ConversionType getType() {
        return ConversionType.HL7;
    }

    @Override
    public boolean validate(String data) {
        if (data == null || data.isBlank()) {
            return false;
        }
        List<String> segments = tokenizer.tokenize(data);
        return !segments.isEmpty() && segments.get(0).startsWith(SEGMENT_MSH);
    }

    @Override
    public ParsedMessage parse(String data) {
        if (!validate(data)) {
            throw InvalidFormatException.missingSegment(SEGMENT_MSH);
        }
        try {
            List<String> segments = tokenizer.tokenize(data);
            log.debug("Tokenized HL7 input into {} segments", segments.size());
            return messageBuilder.buildMessage(segments);
        } catch (RuntimeException e) {
            throw new MessageParseException("HL7 parsing error: " + e.getMessage(), e);
        }
    }

    @Override
    public List<String> rawSegments(String data) {
        return tokenizer.tokenize(data);
    }

    @Override
    public ExtractionResult extractClinicalData(ParsedMessage parsed, List<String> rawSegments) {
        return extractor.extract(parsed, rawSegments);
    }

    @Override
    public Object toPayload(ParsedMessage parsed) {
        return ValueTrees.toPlain(parsed);
    }
}
