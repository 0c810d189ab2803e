package com.al.clinicalconverter.parser.hl7.converter;

import com.al.clinicalconverter.model.hl7.ParsedMessage;

import java.util.List;

public interface SegmentConverter<T> {
    /**
     * Converts the segments this converter handles into normalized values.
     *
     * @param message The parsed HL7 message
     * @param context Shared conversion context (e.g. resolved patient)
     * @return Values in segment source order; empty when the segment is absent
     */
    List<T> convert(ParsedMessage message, ConversionContext context);
}
