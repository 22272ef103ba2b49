package com.gentoro.agentflow.vectorstore;

import com.fasterxml.jackson.core.type.TypeReference;
import com.gentoro.agentflow.exception.VectorStoreException;
import com.gentoro.agentflow.utility.JacksonUtility;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Collection persisted as a JSON file {@code <storagePath>/<collectionName>.json}. The whole file
 * is rewritten through a temporary file and an atomic move after each mutation.
 */
public class LocalVectorStore extends AbstractVectorStore {
  private static final org.slf4j.Logger log =
      com.gentoro.agentflow.logging.LoggingService.getLogger(LocalVectorStore.class);

  private final Path file;

  public LocalVectorStore(CollectionConfig config) {
    super(config);
    this.file = fileFor(config);
    load();
  }

  public static Path fileFor(CollectionConfig config) {
    return config.storagePath().resolve(config.collectionName() + ".json");
  }

  private void load() {
    if (!Files.isRegularFile(file)) return;
    try {
      List<VectorRecord> stored =
          JacksonUtility.getJsonMapper()
              .readValue(file.toFile(), new TypeReference<List<VectorRecord>>() {});
      stored.forEach(r -> records.put(r.id(), r));
      log.info("Loaded {} vectors from {}", stored.size(), file);
    } catch (IOException e) {
      throw new VectorStoreException("Failed to read vector collection file " + file, e);
    }
  }

  @Override
  protected void persist() {
    try {
      Files.createDirectories(file.getParent());
      Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
      JacksonUtility.getJsonMapper().writeValue(tmp.toFile(), List.copyOf(records.values()));
      Files.move(
          tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      throw new VectorStoreException("Failed to write vector collection file " + file, e);
    }
  }

  @Override
  public void drop() {
    records.clear();
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      throw new VectorStoreException("Failed to delete vector collection file " + file, e);
    }
  }
}
