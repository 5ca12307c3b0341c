package com.scholary.notes.config;

import com.scholary.notes.objectstore.ObjectStoreProperties;
import com.scholary.notes.objectstore.S3ObjectStoreClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for object storage.
 *
 * <p>This wires up the ObjectStoreClient bean using properties from application.yml. The client
 * is used to fetch submitted inputs and, with the object-store artifact backend, to store outputs.
 */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean(destroyMethod = "close")
  public S3ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }
}
