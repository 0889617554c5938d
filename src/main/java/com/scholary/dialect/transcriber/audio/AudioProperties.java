package com.scholary.dialect.transcriber.audio;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Audio intake settings ("audio.*").
 *
 * @param localRoot directory that local file sources are resolved against; blank disables local
 *     file sources entirely
 */
@ConfigurationProperties(prefix = "audio")
public record AudioProperties(String localRoot) {

  public boolean localFilesEnabled() {
    return localRoot != null && !localRoot.isBlank();
  }
}
