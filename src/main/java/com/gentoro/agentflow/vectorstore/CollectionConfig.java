package com.gentoro.agentflow.vectorstore;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Identifies a vector collection and the backend holding it.
 *
 * <p>Two configurations with the same {@link #namespaceKey()} address the same collection, whatever
 * their distance metric.
 */
public record CollectionConfig(
    String provider, String collectionName, Path storagePath, DistanceMetric distanceMetric) {

  public CollectionConfig {
    Objects.requireNonNull(provider, "provider");
    Objects.requireNonNull(collectionName, "collectionName");
    Objects.requireNonNull(storagePath, "storagePath");
    provider = provider.trim().toLowerCase(java.util.Locale.ROOT);
    storagePath = storagePath.toAbsolutePath().normalize();
    if (distanceMetric == null) distanceMetric = DistanceMetric.COSINE;
  }

  public static CollectionConfig of(String provider, String collectionName, Path storagePath) {
    return new CollectionConfig(provider, collectionName, storagePath, DistanceMetric.COSINE);
  }

  public NamespaceKey namespaceKey() {
    return new NamespaceKey(provider, collectionName, storagePath.toString());
  }

  /** The (provider, collection name, storage path) triple. */
  public record NamespaceKey(String provider, String collectionName, String storagePath) {
    @Override
    public String toString() {
      return provider + ":" + storagePath + "#" + collectionName;
    }
  }
}
