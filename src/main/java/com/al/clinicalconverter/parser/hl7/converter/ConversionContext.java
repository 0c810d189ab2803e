package com.al.clinicalconverter.parser.hl7.converter;

import com.al.clinicalconverter.model.NormalizedPatient;
import com.al.clinicalconverter.model.hl7.PrescriptionInfo;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * State shared by the segment converters while extracting one message.
 */
@Data
@Builder
public class ConversionContext {

    /**
     * Tokenized segments as they appeared in the source, used by the
     * raw-text PID fallback.
     */
    @Builder.Default
    private List<String> rawSegments = new ArrayList<>();

    /**
     * The single patient resolved for the message, or an unresolved one.
     */
    @Builder.Default
    private NormalizedPatient patient = NormalizedPatient.builder().build();

    /**
     * ORC order details in source order, paired positionally with drug
     * segments.
     */
    @Builder.Default
    private List<PrescriptionInfo> prescriptions = new ArrayList<>();
}
