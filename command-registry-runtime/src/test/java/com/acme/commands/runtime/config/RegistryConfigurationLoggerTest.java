package com.acme.commands.runtime.config;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.mock;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.acme.commands.config.RegistryConfig;
import com.acme.commands.storage.CommandTableOwner;
import com.acme.commands.storage.TableOptions;
import com.acme.commands.storage.WriteConsistency;
import io.micronaut.context.event.StartupEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class RegistryConfigurationLoggerTest {

    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
    private Logger logger;
    private CommandTableOwner owner;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(RegistryConfigurationLogger.class);
        appender.start();
        logger.addAppender(appender);
        owner = CommandTableOwner.start("logger-unit-test", TableOptions.defaults().withGloballyNamed(false));
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
        owner.stop();
    }

    @Test
    @DisplayName("Should log the effective configuration and warn about lossy writes")
    void shouldLogUnsynchronizedConfiguration() {
        RegistryConfig config = new RegistryConfig();
        config.setTableName("logger-unit-test");

        new RegistryConfigurationLogger(config, owner).onApplicationEvent(mock(StartupEvent.class));

        assertThat(appender.list)
                .extracting(ILoggingEvent::getFormattedMessage)
                .anySatisfy(message -> assertThat(message).contains("logger-unit-test"))
                .anySatisfy(message -> assertThat(message).contains("UNSYNCHRONIZED"))
                .anySatisfy(message -> assertThat(message).contains("concurrent updates may be lost"));
    }

    @Test
    @DisplayName("Should not warn when writes are atomic per key")
    void shouldNotWarnForAtomicWrites() {
        RegistryConfig config = new RegistryConfig();
        config.setWriteConsistency(WriteConsistency.PER_KEY_ATOMIC);

        new RegistryConfigurationLogger(config, owner).onApplicationEvent(mock(StartupEvent.class));

        assertThat(appender.list)
                .extracting(ILoggingEvent::getFormattedMessage)
                .noneSatisfy(message -> assertThat(message).contains("may be lost"))
                .anySatisfy(message -> assertThat(message).contains("PER_KEY_ATOMIC"));
    }
}
