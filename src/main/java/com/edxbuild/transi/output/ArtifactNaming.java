package com.edxbuild.transi.output;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Artifact file names: {@code <SOP>_<stage>_<ddMMyy_HHmm>} plus an unstamped
 * {@code <SOP>_<stage>_latest} alias.
 */
public class ArtifactNaming {

    public static final String TIMESTAMP_PATTERN = "ddMMyy_HHmm";
    public static final String LATEST = "latest";

    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern(TIMESTAMP_PATTERN);

    private final Clock clock;
    private final ZoneId zone;

    public ArtifactNaming(Clock clock, ZoneId zone) {
        this.clock = clock;
        this.zone = zone;
    }

    /**
     * Generation timestamp, taken once per run so every artifact of the run shares it.
     */
    public String timestamp() {
        return ZonedDateTime.now(clock.withZone(zone)).format(FORMATTER);
    }

    public String baseName(String sop, String stage, String timestamp) {
        return sop + "_" + stage + "_" + timestamp;
    }

    public String latestBaseName(String sop, String stage) {
        return baseName(sop, stage, LATEST);
    }
}
