package com.al.clinicalconverter.parser.hl7;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class EmbeddedSegmentRepairTest {

    private final EmbeddedSegmentRepair repair = new EmbeddedSegmentRepair();

    @Test
    public void testSplitsPidOutOfMsh() {
        String segment = "MSH|^~\\&|App|Fac|||20150202||ADT^A01|1|P|2.5|PID|1||12345||DOE^JOHN";

        assertTrue(repair.needsRepair(segment));
        assertEquals(List.of("MSH|^~\\&|App|Fac|||20150202||ADT^A01|1|P|2.5", "PID|1||12345||DOE^JOHN"),
                repair.repair(segment));
    }

    @Test
    public void testPidStopsAtNextSegmentMarker() {
        List<String> repaired = repair.repair("MSH|^~\\&|App|PID|1||12345||DOE^JOHN|PV1|1|I");
        assertEquals(List.of("MSH|^~\\&|App", "PID|1||12345||DOE^JOHN"), repaired);
    }

    @Test
    public void testOtherSegmentsPassThrough() {
        assertFalse(repair.needsRepair("PID|1||12345|NK1|1|DOE^MARY"));
        assertEquals(List.of("PID|1||12345|NK1|1|DOE^MARY"), repair.repair("  PID|1||12345|NK1|1|DOE^MARY "));
    }

    @Test
    public void testMshWithoutPidPassesThrough() {
        assertFalse(repair.needsRepair("MSH|^~\\&|App|Fac"));
        assertEquals(List.of("MSH|^~\\&|App|Fac"), repair.repair("MSH|^~\\&|App|Fac "));
    }
}
