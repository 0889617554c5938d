package com.scholary.dialect.transcriber.config;

import com.scholary.dialect.transcriber.objectstore.ObjectStoreProperties;
import com.scholary.dialect.transcriber.objectstore.S3ObjectStoreClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the object store that recordings referenced by bucket and key are read from.
 *
 * <p>The S3 client holds a connection pool, so it is closed with the application context.
 */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean(destroyMethod = "close")
  public S3ObjectStoreClient recordingStore(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }
}
