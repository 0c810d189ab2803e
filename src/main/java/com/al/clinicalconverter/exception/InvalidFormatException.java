package com.al.clinicalconverter.exception;

import com.al.clinicalconverter.model.enums.ConversionType;
import lombok.Getter;

/**
 * Input failed the structural check for its declared format (missing MSH
 * header, malformed XML). Not retryable.
 */
@Getter
public class InvalidFormatException extends ClinicalConversionException {

    private final ConversionType format;

    public InvalidFormatException(ConversionType format, String message) {
        super(message);
        this.format = format;
    }

    public InvalidFormatException(ConversionType format, String message, Throwable cause) {
        super(message, cause);
        this.format = format;
    }

    public static InvalidFormatException missingSegment(String expectedSegment) {
        return new InvalidFormatException(ConversionType.HL7,
                "Invalid HL7 data: message must start with " + expectedSegment + " segment");
    }
}
