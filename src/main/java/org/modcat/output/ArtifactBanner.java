package org.modcat.output;

import org.modcat.transform.SummaryLevel;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * The comment banner at the top of every artifact.
 */
public final class ArtifactBanner {

    public static final String TOOL_NAME = "modcat";
    public static final String VERSION = "1.0.0";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Clock clock;

    public ArtifactBanner(Clock clock) {
        this.clock = clock;
    }

    /**
     * Banner lines without the summary level, shared by the code artifact and the notebook trailer.
     */
    public List<String> lines() {
        return List.of(
                "# Generated by " + TOOL_NAME,
                "#  " + TOOL_NAME + " " + VERSION + " - dependency-ordered module concatenator/summarizer",
                "#  Generated: " + LocalDateTime.now(clock).format(TIMESTAMP));
    }

    /**
     * The full header: banner lines plus the generation level.
     */
    public String header(SummaryLevel level) {
        return String.join("\n", lines()) + "\n# Summary Level: " + level.value();
    }
}
