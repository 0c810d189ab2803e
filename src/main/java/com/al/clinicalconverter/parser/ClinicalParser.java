package com.al.clinicalconverter.parser;

import com.al.clinicalconverter.model.ExtractionResult;
import com.al.clinicalconverter.model.enums.ConversionType;

import java.util.Collections;
import java.util.List;

/**
 * Validate, parse and extract for one source format.
 *
 * @param <T> the parsed form ({@code ParsedMessage} for HL7, the normalized
 *            {@code Value} tree for XML)
 */
public interface ClinicalParser<T> {

    ConversionType getType();

    /**
     * Structural check only; never throws.
     */
    boolean validate(String data);

    /**
     * @throws com.al.clinicalconverter.exception.InvalidFormatException when
     *         {@link #validate(String)} would return false
     * @throws com.al.clinicalconverter.exception.MessageParseException when
     *         valid input cannot be decomposed
     */
    T parse(String data);

    ExtractionResult extractClinicalData(T parsed, List<String> rawSegments);

    /**
     * Source segments handed to {@link #extractClinicalData} for formats with
     * textual fallbacks. Empty by default.
     */
    default List<String> rawSegments(String data) {
        return Collections.emptyList();
    }

    /**
     * Parsed form as plain maps, lists and strings.
     */
    Object toPayload(T parsed);
}
