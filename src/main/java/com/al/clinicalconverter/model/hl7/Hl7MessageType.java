package com.al.clinicalconverter.model.hl7;

import lombok.Value;

/**
 * MSH-9 message type and trigger event, e.g. {@code VXU} / {@code V04}.
 */
@Value
public class Hl7MessageType {

    private static final Hl7MessageType UNKNOWN = new Hl7MessageType("", "");

    String messageType;
    String triggerEvent;

    public static Hl7MessageType unknown() {
        return UNKNOWN;
    }
}
