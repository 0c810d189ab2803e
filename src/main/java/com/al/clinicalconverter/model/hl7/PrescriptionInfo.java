package com.al.clinicalconverter.model.hl7;

import lombok.Builder;
import lombok.Value;

/**
 * Order details read from one ORC segment.
 */
@Value
@Builder
public class PrescriptionInfo {
    @Builder.Default
    String prescriptionId = "";
    @Builder.Default
    String orderControl = "";
    @Builder.Default
    String fillerOrderNumber = "";
    @Builder.Default
    String orderStatus = "";
    @Builder.Default
    String quantityTiming = "";
}
