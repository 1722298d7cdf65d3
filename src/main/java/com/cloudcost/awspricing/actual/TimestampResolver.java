package com.cloudcost.awspricing.actual;

import com.cloudcost.awspricing.domain.model.ConfidenceLevel;
import com.cloudcost.awspricing.domain.model.ResolutionSource;
import com.cloudcost.awspricing.domain.model.TimestampResolution;
import com.cloudcost.awspricing.exception.InvalidResourceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Resolves the window of an actual-cost query and grades how much it can
 * be trusted.
 *
 * RESOLUTION ORDER:
 * 1. Explicit start (and end, when given)
 * 2. Start from the pulumi:created tag
 * 3. Otherwise fail: a start time is required
 *
 * A missing end defaults to now. The source is "mixed" whenever exactly one
 * boundary was explicit. The pulumi:modified tag is never consulted.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TimestampResolver {

    public static final String CREATED_TAG = "pulumi:created";
    public static final String EXTERNAL_TAG = "pulumi:external";

    private static final String SOURCE_PREFIX = "aws-public-fallback";

    private final Clock clock;

    public TimestampResolution resolve(Map<String, String> tags, Instant explicitStart, Instant explicitEnd) {
        boolean imported = isImported(tags);

        Instant start;
        ResolutionSource source;
        if (explicitStart != null) {
            start = explicitStart;
            source = ResolutionSource.EXPLICIT;
        } else {
            start = createdAt(tags);
            if (start == null) {
                throw new InvalidResourceException("start time required: provide explicit Start or pulumi:created tag");
            }
            source = ResolutionSource.PULUMI_CREATED;
        }

        Instant end;
        if (explicitEnd != null) {
            end = explicitEnd;
            if (explicitStart == null) {
                source = ResolutionSource.MIXED;
            }
        } else {
            end = clock.instant();
            if (explicitStart != null) {
                source = ResolutionSource.MIXED;
            }
        }

        log.debug("Timestamps resolved: source={}, imported={}, start={}, end={}",
                source.getValue(), imported, start, end);
        return new TimestampResolution(start, end, source, imported);
    }

    /**
     * Explicit windows are always HIGH; derived windows drop to MEDIUM for
     * imported resources, whose creation tag records the import time.
     */
    public static ConfidenceLevel confidenceOf(TimestampResolution resolution) {
        if (resolution == null) {
            return ConfidenceLevel.LOW;
        }
        if (resolution.source() == ResolutionSource.EXPLICIT) {
            return ConfidenceLevel.HIGH;
        }
        return resolution.imported() ? ConfidenceLevel.MEDIUM : ConfidenceLevel.HIGH;
    }

    public static String formatSource(ConfidenceLevel confidence, boolean imported) {
        String source = String.format("%s[confidence:%s]", SOURCE_PREFIX, confidence.name());
        return imported ? source + " imported resource" : source;
    }

    static boolean isImported(Map<String, String> tags) {
        return tags != null && "true".equals(tags.get(EXTERNAL_TAG));
    }

    private static Instant createdAt(Map<String, String> tags) {
        if (tags == null) {
            return null;
        }
        String value = tags.get(CREATED_TAG);
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            log.warn("Ignoring unparseable {} tag value '{}': {}", CREATED_TAG, value, e.getMessage());
            return null;
        }
    }
}
