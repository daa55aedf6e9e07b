package com.scholary.transcriber.config;

import com.scholary.transcriber.objectstore.ObjectStoreChunkStorage;
import com.scholary.transcriber.objectstore.ObjectStoreProperties;
import com.scholary.transcriber.objectstore.S3ObjectStoreClient;
import com.scholary.transcriber.store.ChunkStorage;
import com.scholary.transcriber.store.InMemoryChunkStorage;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for storage chunk backends.
 *
 * <p>With {@code objectstore.enabled=true} pieces of large files go to S3/MinIO; otherwise they
 * stay in memory.
 */
@Configuration
@EnableConfigurationProperties({ObjectStoreProperties.class, FileStoreProperties.class})
public class ObjectStoreConfig {

  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(prefix = "objectstore", name = "enabled", havingValue = "true")
  public S3ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }

  @Bean
  @ConditionalOnProperty(prefix = "objectstore", name = "enabled", havingValue = "true")
  public ChunkStorage objectStoreChunkStorage(
      S3ObjectStoreClient objectStoreClient, ObjectStoreProperties properties) {
    return new ObjectStoreChunkStorage(objectStoreClient, properties.bucket());
  }

  @Bean
  @ConditionalOnMissingBean(ChunkStorage.class)
  public ChunkStorage inMemoryChunkStorage() {
    return new InMemoryChunkStorage();
  }
}
