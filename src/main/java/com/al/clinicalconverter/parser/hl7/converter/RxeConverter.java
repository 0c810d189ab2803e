package com.al.clinicalconverter.parser.hl7.converter;

import com.al.clinicalconverter.model.NormalizedDrugFact;
import com.al.clinicalconverter.model.hl7.ParsedSegment;
import com.al.clinicalconverter.model.value.Value;
import org.springframework.stereotype.Component;

import static com.al.clinicalconverter.util.MappingConstants.SEGMENT_RXE;

/**
 * RXE (pharmacy encoded order) to drug facts. Only used when the message
 * has no RXA segment.
 */
@Component
public class RxeConverter extends AbstractDrugConverter {

    private static final int RXE_GIVE_CODE = 1;
    private static final int RXE_GIVE_AMOUNT_MIN = 2;
    private static final int RXE_GIVE_UNITS = 4;
    private static final int RXE_GIVE_AMOUNT_MAX = 5;

    @Override
    protected String segmentName() {
        return SEGMENT_RXE;
    }

    @Override
    protected NormalizedDrugFact.NormalizedDrugFactBuilder readSegment(ParsedSegment rxe) {
        return NormalizedDrugFact.builder()
                .drugName(rxe.field(RXE_GIVE_CODE).map(RxeConverter::drugName).orElse(""))
                .strength(rxe.fieldText(RXE_GIVE_AMOUNT_MIN).orElse(""))
                .dosage(rxe.fieldText(RXE_GIVE_UNITS).orElse(""))
                .quantity(parseQuantity(rxe.fieldText(RXE_GIVE_AMOUNT_MAX).orElse("")));
    }

    private static String drugName(Value code) {
        return code.isComposite() ? code.componentText(1) : code.asText();
    }
}
