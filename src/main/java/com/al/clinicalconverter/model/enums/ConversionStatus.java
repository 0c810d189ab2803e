package com.al.clinicalconverter.model.enums;

public enum ConversionStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
}
