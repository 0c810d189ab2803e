package com.al.clinicalconverter.parser.hl7.converter;

import com.al.clinicalconverter.model.hl7.ParsedMessage;
import com.al.clinicalconverter.model.hl7.ParsedSegment;
import com.al.clinicalconverter.model.hl7.RouteInfo;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

import static com.al.clinicalconverter.util.MappingConstants.SEGMENT_RXR;

/**
 * RXR-1 route and RXR-2 site, one entry per segment in source order.
 */
@Component
public class RouteConverter implements SegmentConverter<RouteInfo> {

    @Override
    public List<RouteInfo> convert(ParsedMessage message, ConversionContext context) {
        List<RouteInfo> routes = new ArrayList<>();
        for (ParsedSegment rxr : message.segments(SEGMENT_RXR)) {
            routes.add(new RouteInfo(rxr.fieldText(1).orElse(""), rxr.fieldText(2).orElse("")));
        }
        return routes;
    }
}
