package com.al.clinicalconverter.parser.hl7;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Repairs single-line HL7 input where the PID segment was folded into the
 * tail of the MSH segment.
 *
 * <p>
 * {@code MSH|^~\&|APP|...|2.5.1|PID|1||12345||DOE^JOHN} becomes
 * {@code MSH|^~\&|APP|...|2.5.1} and {@code PID|1||12345||DOE^JOHN}. The
 * synthesized PID runs up to the next {@code |XXX|} segment marker or the
 * end of the text.
 *
 * <p>
 * Only MSH-containing-PID is handled; other embeddings pass through
 * unchanged.
 */
@Slf4j
@Component
public class EmbeddedSegmentRepair {

    private static final Pattern EMBEDDED_PID = Pattern.compile("\\|PID\\|(.+)");
    private static final Pattern SEGMENT_MARKER = Pattern.compile("\\|[A-Z]{3}\\|");

    /**
     * Whether {@code segment} is an MSH segment carrying an embedded PID.
     */
    public boolean needsRepair(String segment) {
        return segment.stripLeading().startsWith("MSH") && EMBEDDED_PID.matcher(segment).find();
    }

    /**
     * Splits an MSH segment with an embedded PID into two segments; any other
     * segment is returned trimmed as the only element.
     */
    public List<String> repair(String segment) {
        String content = segment.stripLeading();
        if (!content.startsWith("MSH")) {
            return List.of(segment.trim());
        }

        Matcher pidMatch = EMBEDDED_PID.matcher(content);
        if (!pidMatch.find()) {
            return List.of(segment.trim());
        }

        String msh = content.substring(0, pidMatch.start()).trim();
        String pidData = pidMatch.group(1);
        Matcher next = SEGMENT_MARKER.matcher(pidData);
        if (next.find()) {
            pidData = pidData.substring(0, next.start());
        }
        String pid = ("PID|" + pidData).trim();

        log.warn("Split embedded PID out of MSH segment");
        return List.of(msh, pid);
    }
}
