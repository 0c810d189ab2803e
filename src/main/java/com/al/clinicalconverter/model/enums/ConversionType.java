package com.al.clinicalconverter.model.enums;

/**
 * Source format of a conversion. Supplied by the caller; input is never
 * sniffed.
 */
public enum ConversionType {
    XML,
    HL7
}
