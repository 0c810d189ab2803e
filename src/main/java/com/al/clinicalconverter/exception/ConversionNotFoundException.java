package com.al.clinicalconverter.exception;

import lombok.Getter;

@Getter
public class ConversionNotFoundException extends RuntimeException {

    private final String conversionId;

    public ConversionNotFoundException(String conversionId) {
        super("Conversion not found: " + conversionId);
        this.conversionId = conversionId;
    }
}
