package com.al.clinicalconverter.parser.hl7.converter;

import com.al.clinicalconverter.model.hl7.ParsedMessage;
import com.al.clinicalconverter.model.hl7.ParsedSegment;
import com.al.clinicalconverter.model.hl7.PrescriptionInfo;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

import static com.al.clinicalconverter.util.MappingConstants.SEGMENT_ORC;

/**
 * Reads every ORC segment into a {@link PrescriptionInfo}, one per segment in
 * source order, so the i-th entry pairs with the i-th drug segment.
 */
@Component
public class OrderConverter implements SegmentConverter<PrescriptionInfo> {

    @Override
    public List<PrescriptionInfo> convert(ParsedMessage message, ConversionContext context) {
        List<PrescriptionInfo> prescriptions = new ArrayList<>();
        for (ParsedSegment orc : message.segments(SEGMENT_ORC)) {
            prescriptions.add(PrescriptionInfo.builder()
                    .orderControl(orc.firstComponentText(1).orElse(""))
                    .prescriptionId(orc.firstComponentText(2).orElse(""))
                    .fillerOrderNumber(orc.firstComponentText(3).orElse(""))
                    .orderStatus(orc.firstComponentText(5).orElse(""))
                    .quantityTiming(orc.fieldText(7).orElse(""))
                    .build());
        }
        return prescriptions;
    }
}
