package org.modcat.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

class LoggingConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

    @AfterEach
    void tearDown() {
        context.getLogger("org.modcat.sample").setLevel(null);
        context.getLogger("org.modcat.other").setLevel(null);
    }

    @Test
    @Tag("unit")
    void appliesLevelsFromConfiguration() {
        LoggingConfigurator.configure(ConfigFactory.parseString(
                "logging.levels { \"org.modcat.sample\" = DEBUG, \"org.modcat.other\" = ERROR }"));

        assertThat(context.getLogger("org.modcat.sample").getLevel()).isEqualTo(Level.DEBUG);
        assertThat(context.getLogger("org.modcat.other").getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    @Tag("unit")
    void unknownLevelFallsBackToInfo() {
        LoggingConfigurator.setLevel("org.modcat.sample", "LOUD");

        assertThat(context.getLogger("org.modcat.sample").getLevel()).isEqualTo(Level.INFO);
    }
}
