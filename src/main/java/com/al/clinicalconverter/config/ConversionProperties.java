package com.al.clinicalconverter.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for clinical message parsing and conversion processing.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "app.conversion")
public class ConversionProperties {

    /**
     * Whether single-line HL7 MSH segments that swallowed a PID segment are
     * split back into MSH and PID.
     */
    private boolean embeddedSegmentRepair = true;

    /**
     * Whether the payload stored on a completed conversion includes the
     * parsed message tree.
     */
    private boolean includeParsedDataInPayload = true;

    /**
     * Conversions slower than this are logged at WARN.
     */
    private long slowConversionThresholdMs = 5000;
}
