package com.al.clinicalconverter.parser.xml;

import com.al.clinicalconverter.exception.InvalidFormatException;
import com.al.clinicalconverter.exception.MessageParseException;
import com.al.clinicalconverter.model.ExtractionResult;
import com.al.clinicalconverter.model.enums.ConversionType;
import com.al.clinicalconverter.model.value.Value;
import com.al.clinicalconverter.parser.ClinicalParser;
import com.al.clinicalconverter.util.ValueTrees;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Generic clinical XML (prescription/patient/medications and look-alikes).
 */
@Service
public class XmlParser implements ClinicalParser<Value> {

    private final XmlTreeNormalizer normalizer;
    private final XmlClinicalExtractor extractor;

    public XmlParser(XmlTreeNormalizer normalizer, XmlClinicalExtractor extractor) {
        this.normalizer = normalizer;
        this.extractor = extractor;
    }

    @Override
    public ConversionType getType() {
        return ConversionType.XML;
    }

    @Override
    public boolean validate(String data) {
        return normalizer.isWellFormed(data);
    }

    @Override
    public Value parse(String data) {
        try {
            return normalizer.normalize(data);
        } catch (InvalidFormatException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MessageParseException("XML parsing error: " + e.getMessage(), e);
        }
    }

    @Override
    public ExtractionResult extractClinicalData(Value parsed, List<String> rawSegments) {
        return extractor.extract(parsed);
    }

    @Override
    public Object toPayload(Value parsed) {
        return ValueTrees.toPlain(parsed);
    }
}
