package com.al.clinicalconverter.model.hl7;

import lombok.Value;

/**
 * Route and site read from one RXR segment.
 */
@Value
public class RouteInfo {
    String administrationRoute;
    String administrationSite;
}
