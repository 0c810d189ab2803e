package com.al.clinicalconverter.parser.hl7;

import com.al.clinicalconverter.config.ConversionProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits raw HL7 text into segment strings.
 *
 * <p>
 * Text with line breaks is split on every CR or LF, whichever convention (or
 * mix of them) the sender used. Single-line text has no reliable delimiter,
 * so segment starts are inferred from {@code |XXX|} markers (three uppercase
 * letters between pipes), and each inferred segment goes through
 * {@link EmbeddedSegmentRepair}. Text with neither is a single segment.
 */
@Slf4j
@Component
public class SegmentTokenizer {

    private static final Pattern SEGMENT_BOUNDARY = Pattern.compile("\\|([A-Z]{3})\\|");

    private final EmbeddedSegmentRepair embeddedSegmentRepair;
    private final ConversionProperties properties;

    public SegmentTokenizer(EmbeddedSegmentRepair embeddedSegmentRepair, ConversionProperties properties) {
        this.embeddedSegmentRepair = embeddedSegmentRepair;
        this.properties = properties;
    }

    /**
     * @param raw raw HL7 text
     * @return trimmed, non-empty segments in source order; empty for blank
     *         input
     */
    public List<String> tokenize(String raw) {
        if (raw == null || raw.isBlank()) {
            return Collections.emptyList();
        }
        if (raw.indexOf('\r') >= 0 || raw.indexOf('\n') >= 0) {
            return splitOnLineBreaks(raw);
        }
        return splitSingleLine(raw);
    }

    private List<String> splitOnLineBreaks(String raw) {
        List<String> segments = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == '\r' || c == '\n') {
                addIfNotBlank(segments, current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        addIfNotBlank(segments, current.toString());
        return segments;
    }

    private List<String> splitSingleLine(String raw) {
        Matcher matcher = SEGMENT_BOUNDARY.matcher(raw);
        List<String> segments = new ArrayList<>();
        int start = 0;
        boolean foundBoundary = false;

        while (matcher.find()) {
            foundBoundary = true;
            int segmentStart = matcher.start() + 1;
            if (start < segmentStart) {
                addInferredSegment(segments, raw.substring(start, segmentStart));
            }
            start = segmentStart;
        }

        if (!foundBoundary) {
            log.debug("No segment markers in single-line HL7 input, treating it as one segment");
            return List.of(raw.trim());
        }

        if (start < raw.length()) {
            addInferredSegment(segments, raw.substring(start));
        }
        log.debug("Inferred {} segments from single-line HL7 input", segments.size());
        return segments;
    }

    private void addInferredSegment(List<String> segments, String content) {
        if (content.isBlank()) {
            return;
        }
        if (properties.isEmbeddedSegmentRepair() && embeddedSegmentRepair.needsRepair(content)) {
            segments.addAll(embeddedSegmentRepair.repair(content));
        } else {
            segments.add(content.trim());
        }
    }

    private static void addIfNotBlank(List<String> segments, String segment) {
        String trimmed = segment.trim();
        if (!trimmed.isEmpty()) {
            segments.add(trimmed);
        }
    }
}
