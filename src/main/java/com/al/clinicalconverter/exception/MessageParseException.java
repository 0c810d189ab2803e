package com.al.clinicalconverter.exception;

/**
 * Input passed validation but could not be decomposed.
 */
public class MessageParseException extends ClinicalConversionException {

    public MessageParseException(String message) {
        super(message);
    }

    public MessageParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
