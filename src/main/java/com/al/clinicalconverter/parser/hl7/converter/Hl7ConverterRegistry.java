package com.al.clinicalconverter.parser.hl7.converter;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Service
public class Hl7ConverterRegistry {

    private final PatientConverter patientConverter;
    private final OrderConverter orderConverter;
    private final RxaConverter rxaConverter;
    private final RxeConverter rxeConverter;
    private final RouteConverter routeConverter;

    @Autowired
    public Hl7ConverterRegistry(
            PatientConverter patientConverter,
            OrderConverter orderConverter,
            RxaConverter rxaConverter,
            RxeConverter rxeConverter,
            RouteConverter routeConverter) {
        this.patientConverter = patientConverter;
        this.orderConverter = orderConverter;
        this.rxaConverter = rxaConverter;
        this.rxeConverter = rxeConverter;
        this.routeConverter = routeConverter;
    }

    public PatientConverter getPatientConverter() {
        return patientConverter;
    }

    public OrderConverter getOrderConverter() {
        return orderConverter;
    }

    public RxaConverter getRxaConverter() {
        return rxaConverter;
    }

    public RxeConverter getRxeConverter() {
        return rxeConverter;
    }

    public RouteConverter getRouteConverter() {
        return routeConverter;
    }
}
