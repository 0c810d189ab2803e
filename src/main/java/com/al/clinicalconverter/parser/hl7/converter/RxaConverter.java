package com.al.clinicalconverter.parser.hl7.converter;

import com.al.clinicalconverter.model.NormalizedDrugFact;
import com.al.clinicalconverter.model.hl7.ParsedSegment;
import com.al.clinicalconverter.model.value.Value;
import com.al.clinicalconverter.util.Hl7DateUtil;
import com.al.clinicalconverter.util.ValueParsers;
import org.springframework.stereotype.Component;

import java.util.Optional;

import static com.al.clinicalconverter.util.MappingConstants.META_ADMINISTRATION_DATE;
import static com.al.clinicalconverter.util.MappingConstants.META_ADMINISTRATION_INFO;
import static com.al.clinicalconverter.util.MappingConstants.SEGMENT_RXA;

/**
 * RXA (pharmacy/treatment administration) to drug facts.
 *
 * <pre>
 * RXA|0|1|20141215||141^influenza, SEASONAL 36^CVX|0.5|mL||00^NEW IMMUNIZATION RECORD^NIP001
 *   drugName = influenza, SEASONAL 36
 *   administrationDate = 2014-12-15
 *   dosage = 0.5, quantity = null
 * </pre>
 */
@Component
public class RxaConverter extends AbstractDrugConverter {

    private static final int RXA_START_DATE = 3;
    private static final int RXA_ADMINISTERED_CODE = 5;
    private static final int RXA_ADMINISTERED_AMOUNT = 6;
    private static final int RXA_ADMINISTRATION_NOTES = 9;
    private static final int RXA_COMPLETION_STATUS = 21;

    @Override
    protected String segmentName() {
        return SEGMENT_RXA;
    }

    @Override
    protected NormalizedDrugFact.NormalizedDrugFactBuilder readSegment(ParsedSegment rxa) {
        String dosage = rxa.fieldText(RXA_ADMINISTERED_AMOUNT).orElse("");
        Optional<String> rawDate = rxa.firstComponentText(RXA_START_DATE);

        NormalizedDrugFact.NormalizedDrugFactBuilder builder = NormalizedDrugFact.builder()
                .drugName(rxa.field(RXA_ADMINISTERED_CODE).map(RxaConverter::drugName).orElse(""))
                .administrationDate(rawDate.flatMap(Hl7DateUtil::parseHl7Date).orElse(""))
                .dosage(dosage)
                .quantity(parseQuantity(dosage))
                .completionStatus(rxa.fieldText(RXA_COMPLETION_STATUS).orElse(""));
        putIfNotEmpty(builder, META_ADMINISTRATION_DATE, rawDate.orElse(""));
        putIfNotEmpty(builder, META_ADMINISTRATION_INFO, rxa.fieldText(RXA_ADMINISTRATION_NOTES).orElse(""));
        return builder;
    }

    /**
     * CE text (component 1), else identifier (0), else alternate text (4).
     */
    private static String drugName(Value code) {
        if (!code.isComposite()) {
            return code.asText();
        }
        return ValueParsers.firstNonEmpty(code.componentText(1), code.componentText(0), code.componentText(4));
    }
}
