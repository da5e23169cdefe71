package com.trendlens.engine.config;

import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "trendlens.store")
public record StoreProperties(@DefaultValue("./data/snapshots") String root) {

  public Path rootPath() {
    return Path.of(root == null || root.isBlank() ? "./data/snapshots" : root);
  }
}
