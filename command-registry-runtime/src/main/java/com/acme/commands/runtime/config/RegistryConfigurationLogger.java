package com.acme.commands.runtime.config;

import com.acme.commands.config.RegistryConfig;
import com.acme.commands.storage.CommandTableOwner;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.inject.Singleton;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Logs the effective registry configuration on startup. Disabled in the test environment.
 */
@Singleton
@Requires(notEnv = "test")
@RequiredArgsConstructor
@Slf4j
public class RegistryConfigurationLogger implements ApplicationEventListener<StartupEvent> {

  private final RegistryConfig config;
  private final CommandTableOwner owner;

  @Override
  public void onApplicationEvent(StartupEvent event) {
    log.info("━━━ Command Registry Configuration ━━━");
    log.info("  Table Name:         {} (global name of the command table)", config.getTableName());
    log.info("  Global Name:        {}", config.isGloballyNamed() ? "REGISTERED" : "PRIVATE");
    log.info("  Read Concurrency:   {}", config.isReadConcurrency() ? "LOCK-FREE" : "SINGLE LOCK");
    log.info("  Key Order:          {}", config.isOrderedKeys() ? "SORTED" : "HASHED");
    log.info("  Writers:            {}", config.isPubliclyWritable() ? "ANY THREAD" : "OWNER ONLY");
    log.info("  Write Consistency:  {}", config.getWriteConsistency());
    if (config.isLossyWrites()) {
      log.warn(
          "  Nested writes under the same top-level name are not serialized; concurrent updates may be lost");
    }
    log.info("  Table Running:      {}", owner.isRunning());
  }
}
