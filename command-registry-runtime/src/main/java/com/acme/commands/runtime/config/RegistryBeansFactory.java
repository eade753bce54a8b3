package com.acme.commands.runtime.config;

import com.acme.commands.config.RegistryConfig;
import com.acme.commands.spi.CommandStorage;
import com.acme.commands.storage.CommandTableOwner;
import com.acme.commands.storage.TableCommandStorage;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Context;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;

/**
 * Factory for the registry beans.
 *
 * <p>The core module stays free of framework dependencies; this factory wires its POJOs into
 * Micronaut. The table owner is created eagerly with the context and stopped when the context
 * closes, which destroys the table.
 */
@Factory
public class RegistryBeansFactory {

  /** Creates RegistryConfig from the bound registry.* properties */
  @Singleton
  public RegistryConfig registryConfig(RegistryProperties properties) {
    return properties.toConfig();
  }

  @Context
  @Bean(preDestroy = "stop")
  public CommandTableOwner commandTableOwner(RegistryConfig config) {
    return CommandTableOwner.start(config.getTableName(), config.toTableOptions());
  }

  /** Storage bound to the owner's table handle */
  @Singleton
  public CommandStorage commandStorage(CommandTableOwner owner, RegistryConfig config) {
    return new TableCommandStorage(owner.getTableHandle(), config.getWriteConsistency());
  }
}
