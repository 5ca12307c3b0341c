package com.scholary.notes.media;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Deletes temporary files. Failures are logged, never thrown. */
public final class TempFileCleaner {

  private static final Logger LOGGER = LoggerFactory.getLogger(TempFileCleaner.class);

  private TempFileCleaner() {}

  /**
   * Delete each path that still exists.
   *
   * @return number of files deleted
   */
  public static int deleteAll(Collection<Path> paths) {
    int deleted = 0;
    for (Path path : paths) {
      if (path != null && delete(path)) {
        deleted++;
      }
    }
    return deleted;
  }

  /** Delete one file; returns true if it existed and was removed. */
  public static boolean delete(Path path) {
    try {
      boolean deleted = Files.deleteIfExists(path);
      if (deleted) {
        LOGGER.debug("Cleaned up temporary file: {}", path);
      }
      return deleted;
    } catch (IOException e) {
      LOGGER.warn("Failed to clean up file {}: {}", path, e.getMessage());
      return false;
    }
  }
}
