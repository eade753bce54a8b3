package com.acme.commands.runtime.config;

import static org.assertj.core.api.Assertions.*;

import com.acme.commands.config.RegistryConfig;
import com.acme.commands.registry.CommandGroup;
import com.acme.commands.registry.CommandRef;
import com.acme.commands.spi.CommandStorage;
import com.acme.commands.storage.CommandTable;
import com.acme.commands.storage.CommandTableOwner;
import com.acme.commands.storage.NamedTables;
import com.acme.commands.storage.TableCommandStorage;
import com.acme.commands.storage.WriteConsistency;
import io.micronaut.context.ApplicationContext;
import io.micronaut.context.env.Environment;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for the registry wiring.
 *
 * <p>Covers the plain factory methods and a real Micronaut context started with {@code registry.*}
 * properties.
 */
@DisplayName("Registry Wiring Tests")
class RegistryBeansFactoryTest {

    @Nested
    @DisplayName("RegistryBeansFactory Tests")
    class FactoryTests {

        private RegistryBeansFactory factory;

        @BeforeEach
        void setUp() {
            factory = new RegistryBeansFactory();
        }

        @Test
        @DisplayName("Should create RegistryConfig from default properties")
        void shouldCreateDefaultConfig() {
            RegistryConfig config = factory.registryConfig(new RegistryProperties());

            assertThat(config.getTableName()).isEqualTo(CommandTableOwner.DEFAULT_TABLE);
            assertThat(config.isGloballyNamed()).isTrue();
            assertThat(config.getWriteConsistency()).isEqualTo(WriteConsistency.UNSYNCHRONIZED);
        }

        @Test
        @DisplayName("Should create storage bound to the owner's table")
        void shouldCreateStorage() {
            RegistryProperties properties = new RegistryProperties();
            properties.setTableName("factory-test");
            properties.setGloballyNamed(false);
            properties.setWriteConsistency(WriteConsistency.PER_KEY_ATOMIC);
            RegistryConfig config = factory.registryConfig(properties);

            try (CommandTableOwner owner = factory.commandTableOwner(config)) {
                CommandStorage storage = factory.commandStorage(owner, config);

                assertThat(storage).isInstanceOf(TableCommandStorage.class);
                TableCommandStorage tableStorage = (TableCommandStorage) storage;
                assertThat(tableStorage.getTable()).isSameAs(owner.getTableHandle());
                assertThat(tableStorage.getConsistency()).isEqualTo(WriteConsistency.PER_KEY_ATOMIC);
            }
        }
    }

    @Nested
    @DisplayName("Application Context Tests")
    class ContextTests {

        @Test
        @DisplayName("Should bind registry properties and expose working storage")
        void shouldWireStorage() {
            Map<String, Object> properties =
                    Map.of(
                            "registry.table-name", "context-test",
                            "registry.ordered-keys", false,
                            "registry.write-consistency", "PER_KEY_ATOMIC");

            try (ApplicationContext context = ApplicationContext.run(properties, Environment.TEST)) {
                RegistryConfig config = context.getBean(RegistryConfig.class);
                assertThat(config.getTableName()).isEqualTo("context-test");
                assertThat(config.isOrderedKeys()).isFalse();
                assertThat(config.getWriteConsistency()).isEqualTo(WriteConsistency.PER_KEY_ATOMIC);

                CommandStorage storage = context.getBean(CommandStorage.class);
                CommandRef ban = CommandRef.of("ban");
                assertThat(storage.addCommand(List.of("mod", "ban"), ban).isOk()).isTrue();
                assertThat(storage.lookupCommand("mod")).contains(CommandGroup.of("ban", ban));

                CommandTable table = context.getBean(CommandTableOwner.class).getTableHandle();
                assertThat(NamedTables.lookup("context-test")).containsSame(table);
            }
        }

        @Test
        @DisplayName("Should destroy the table when the context closes")
        void shouldStopOwnerOnClose() {
            CommandTableOwner owner;
            CommandTable table;
            try (ApplicationContext context =
                    ApplicationContext.run(Map.of("registry.table-name", "close-test"), Environment.TEST)) {
                owner = context.getBean(CommandTableOwner.class);
                table = owner.getTableHandle();
            }

            assertThat(owner.isRunning()).isFalse();
            assertThat(table.isDestroyed()).isTrue();
            assertThat(NamedTables.isRegistered("close-test")).isFalse();
        }

        @Test
        @DisplayName("Should not start the configuration logger in the test environment")
        void shouldSkipConfigurationLogger() {
            try (ApplicationContext context =
                    ApplicationContext.run(Map.of("registry.table-name", "logger-test"), Environment.TEST)) {
                assertThat(context.containsBean(RegistryConfigurationLogger.class)).isFalse();
            }
        }
    }
}
