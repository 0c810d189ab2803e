package com.al.clinicalconverter.util;

/**
 * Delimiters, segment names, sentinel values and metadata keys shared by the
 * parsers and extractors.
 *
 * @author FHIR Transformer Team
 * @since 2.0.0
 */
public final class MappingConstants {

    private MappingConstants() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    // ========================================================================
    // HL7 v2 delimiters
    // ========================================================================

    public static final char FIELD_DELIMITER = '|';
    public static final char COMPONENT_DELIMITER = '^';
    public static final char SUBCOMPONENT_DELIMITER = '&';

    // ========================================================================
    // HL7 segment names
    // ========================================================================

    public static final String SEGMENT_MSH = "MSH";
    public static final String SEGMENT_PID = "PID";
    public static final String SEGMENT_PV1 = "PV1";
    public static final String SEGMENT_ORC = "ORC";
    public static final String SEGMENT_RXA = "RXA";
    public static final String SEGMENT_RXE = "RXE";
    public static final String SEGMENT_RXR = "RXR";

    // ========================================================================
    // PV1-derived patient sentinels
    // ========================================================================

    /** Patient id used when PV1 carries no usable visit number */
    public static final String PV1_PATIENT_ID = "PV1_PATIENT";

    public static final String PV1_PATIENT_NAME = "Patient from PV1";

    /** Birth date meaning "unknown, derived from PV1" */
    public static final String PV1_DATE_OF_BIRTH = "1900-01-01";

    // ========================================================================
    // XML
    // ========================================================================

    /** Reserved key holding an element's attributes */
    public static final String XML_ATTRIBUTES_KEY = "@attributes";

    // ========================================================================
    // Metadata keys
    // ========================================================================

    public static final String META_SOURCE_FORMAT = "source_format";
    public static final String META_SOURCE_SEGMENT = "source_segment";
    public static final String META_SEGMENT_TYPE = "segment_type";
    public static final String META_ADMINISTRATION_DATE = "administration_date";
    public static final String META_ADMINISTRATION_INFO = "administration_info";
    public static final String META_ADMINISTRATION_ROUTE = "administration_route";
    public static final String META_ADMINISTRATION_SITE = "administration_site";
    public static final String META_ORDER_CONTROL = "order_control";
    public static final String META_FILLER_ORDER_NUMBER = "filler_order_number";
    public static final String META_ORDER_STATUS = "order_status";
    public static final String META_QUANTITY_TIMING = "quantity_timing";
    public static final String META_PATIENT_SOURCE = "patient_source";
    public static final String META_MESSAGE_TYPE = "message_type";
    public static final String META_TRIGGER_EVENT = "trigger_event";
    public static final String META_PRESCRIPTION_PREFIX = "prescription.";
}
