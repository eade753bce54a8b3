package com.acme.commands.runtime.config;

import com.acme.commands.config.RegistryConfig;
import com.acme.commands.storage.CommandTableOwner;
import com.acme.commands.storage.WriteConsistency;
import io.micronaut.context.annotation.ConfigurationProperties;
import lombok.Getter;
import lombok.Setter;

/** Binds {@code registry.*} from application.yml. */
@ConfigurationProperties("registry")
@Getter
@Setter
public class RegistryProperties {
  private String tableName = CommandTableOwner.DEFAULT_TABLE;
  private boolean readConcurrency = true;
  private boolean orderedKeys = true;
  private boolean publiclyWritable = true;
  private boolean globallyNamed = true;
  private WriteConsistency writeConsistency = WriteConsistency.UNSYNCHRONIZED;

  public RegistryConfig toConfig() {
    RegistryConfig config = new RegistryConfig();
    config.setTableName(tableName);
    config.setReadConcurrency(readConcurrency);
    config.setOrderedKeys(orderedKeys);
    config.setPubliclyWritable(publiclyWritable);
    config.setGloballyNamed(globallyNamed);
    config.setWriteConsistency(writeConsistency);
    return config;
  }
}
