package com.al.clinicalconverter.parser.hl7;

import com.al.clinicalconverter.model.ExtractionResult;
import com.al.clinicalconverter.model.NormalizedDrugFact;
import com.al.clinicalconverter.model.NormalizedPatient;
import com.al.clinicalconverter.model.hl7.ParsedMessage;
import com.al.clinicalconverter.model.hl7.RouteInfo;
import com.al.clinicalconverter.parser.hl7.converter.AbstractDrugConverter;
import com.al.clinicalconverter.parser.hl7.converter.ConversionContext;
import com.al.clinicalconverter.parser.hl7.converter.Hl7ConverterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.al.clinicalconverter.util.MappingConstants.META_ADMINISTRATION_ROUTE;
import static com.al.clinicalconverter.util.MappingConstants.META_ADMINISTRATION_SITE;
import static com.al.clinicalconverter.util.MappingConstants.SEGMENT_RXA;
import static com.al.clinicalconverter.util.MappingConstants.SEGMENT_RXE;

/**
 * Walks a {@link ParsedMessage} and produces its patient and drug facts.
 *
 * <p>
 * Order of work:
 * <ol>
 * <li>ORC segments into prescription details</li>
 * <li>the single patient (PID, embedded PID text, PV1)</li>
 * <li>drug facts from RXA, or from RXE when there is no RXA</li>
 * <li>RXR route and site onto the emitted drug facts by position</li>
 * </ol>
 */
@Slf4j
@Service
public class Hl7ClinicalExtractor {

    private final Hl7ConverterRegistry converterRegistry;

    public Hl7ClinicalExtractor(Hl7ConverterRegistry converterRegistry) {
        this.converterRegistry = converterRegistry;
    }

    public ExtractionResult extract(ParsedMessage message, List<String> rawSegments) {
        ConversionContext context = ConversionContext.builder()
                .rawSegments(rawSegments == null ? new ArrayList<>() : rawSegments)
                .build();

        context.setPrescriptions(converterRegistry.getOrderConverter().convert(message, context));

        List<NormalizedPatient> patients = converterRegistry.getPatientConverter().convert(message, context);
        if (!patients.isEmpty()) {
            context.setPatient(patients.get(0));
        }

        List<NormalizedDrugFact> drugs = drugConverterFor(message)
                .map(converter -> converter.convert(message, context))
                .orElseGet(ArrayList::new);
        drugs = applyRoutes(drugs, converterRegistry.getRouteConverter().convert(message, context));

        log.debug("Extracted {} patient(s) and {} drug record(s) from {} message", patients.size(),
                drugs.size(), message.getMessageType().getMessageType());
        return ExtractionResult.builder()
                .patients(patients)
                .drugRecords(drugs)
                .build();
    }

    private Optional<AbstractDrugConverter> drugConverterFor(ParsedMessage message) {
        if (message.hasSegment(SEGMENT_RXA)) {
            if (message.hasSegment(SEGMENT_RXE)) {
                log.debug("Message has both RXA and RXE segments; using RXA");
            }
            return Optional.of(converterRegistry.getRxaConverter());
        }
        if (message.hasSegment(SEGMENT_RXE)) {
            return Optional.of(converterRegistry.getRxeConverter());
        }
        return Optional.empty();
    }

    private static List<NormalizedDrugFact> applyRoutes(List<NormalizedDrugFact> drugs, List<RouteInfo> routes) {
        if (routes.isEmpty()) {
            return drugs;
        }
        if (routes.size() > drugs.size()) {
            log.debug("Ignoring {} RXR segment(s) without a matching drug record", routes.size() - drugs.size());
        }
        List<NormalizedDrugFact> routed = new ArrayList<>(drugs.size());
        for (int i = 0; i < drugs.size(); i++) {
            NormalizedDrugFact drug = drugs.get(i);
            if (i < routes.size()) {
                RouteInfo route = routes.get(i);
                drug = drug.toBuilder()
                        .metadataEntry(META_ADMINISTRATION_ROUTE, route.getAdministrationRoute())
                        .metadataEntry(META_ADMINISTRATION_SITE, route.getAdministrationSite())
                        .build();
            }
            routed.add(drug);
        }
        return routed;
    }
}
