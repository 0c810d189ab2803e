package com.al.clinicalconverter.exception;

/**
 * Base type for failures raised while validating, parsing or extracting
 * clinical input. A conversion that raises one of these ends in FAILED.
 */
public class ClinicalConversionException extends RuntimeException {

    public ClinicalConversionException(String message) {
        super(message);
    }

    public ClinicalConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
