package com.al.clinicalconverter.parser;

import com.al.clinicalconverter.model.enums.ConversionType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up the parser for a conversion type. The caller always names the
 * type; input is never sniffed.
 */
@Slf4j
@Service
public class ClinicalParserRegistry {

    private final Map<ConversionType, ClinicalParser<?>> parsers = new EnumMap<>(ConversionType.class);

    public ClinicalParserRegistry(List<ClinicalParser<?>> parsers) {
        for (ClinicalParser<?> parser : parsers) {
            this.parsers.put(parser.getType(), parser);
        }
        log.info("Registered clinical parsers for {}", this.parsers.keySet());
    }

    public ClinicalParser<?> getParser(ConversionType type) {
        ClinicalParser<?> parser = parsers.get(type);
        if (parser == null) {
            throw new IllegalArgumentException("No parser registered for conversion type " + type);
        }
        return parser;
    }
}
