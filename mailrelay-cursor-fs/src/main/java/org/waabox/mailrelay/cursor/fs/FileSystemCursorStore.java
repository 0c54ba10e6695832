package org.waabox.mailrelay.cursor.fs;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

import org.waabox.mailrelay.cursor.CursorStore;
import org.waabox.mailrelay.cursor.CursorStoreException;

/**
 * A {@link CursorStore} implementation that keeps each value in a file on
 * the local filesystem.
 *
 * <p>The key is a relative path below the base directory, so a key such as
 * {@code lastHistoryId/someone@example.com} is stored as:
 * <pre>
 * {baseDir}/
 *   lastHistoryId/
 *     someone@example.com
 * </pre>
 *
 * <p>Writes go to a temporary file that is then atomically renamed over the
 * previous value. If the JVM crashes mid-write, the previous cursor remains
 * intact.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FileSystemCursorStore implements CursorStore {

  /** Suffix of the temporary file used while writing. */
  private static final String TEMP_SUFFIX = ".tmp";

  /** The base directory where all values are stored. */
  private final Path baseDir;

  /**
   * Creates a new FileSystemCursorStore with the given base directory.
   *
   * <p>If the base directory does not exist, it is created along with any
   * necessary parent directories.
   *
   * @param baseDir the base directory, never null
   *
   * @throws CursorStoreException if the directory cannot be created
   */
  public FileSystemCursorStore(final Path baseDir) {
    Objects.requireNonNull(baseDir, "baseDir must not be null");
    this.baseDir = baseDir.toAbsolutePath().normalize();

    try {
      Files.createDirectories(this.baseDir);
    } catch (final IOException e) {
      throw new CursorStoreException(
          "Failed to create base directory: " + baseDir, e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public Optional<String> read(final String key) {
    final Path file = resolve(key);

    try {
      return Optional.of(Files.readString(file, StandardCharsets.UTF_8)
          .trim());
    } catch (final NoSuchFileException e) {
      return Optional.empty();
    } catch (final IOException e) {
      throw new CursorStoreException("Failed to read cursor: " + key, e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void write(final String key, final String value) {
    Objects.requireNonNull(value, "value must not be null");

    final Path file = resolve(key);
    final Path tempFile = file.resolveSibling(file.getFileName()
        + TEMP_SUFFIX);

    try {
      Files.createDirectories(file.getParent());
      Files.writeString(tempFile, value, StandardCharsets.UTF_8);
      Files.move(tempFile, file,
          StandardCopyOption.REPLACE_EXISTING,
          StandardCopyOption.ATOMIC_MOVE);
    } catch (final IOException e) {
      throw new CursorStoreException("Failed to write cursor: " + key, e);
    }
  }

  /**
   * Maps a key to its file, refusing keys that escape the base directory.
   *
   * @param key the key, never null
   * @return the file path, never null
   */
  private Path resolve(final String key) {
    Objects.requireNonNull(key, "key must not be null");
    if (key.isBlank()) {
      throw new IllegalArgumentException("key must not be blank");
    }

    final Path file = baseDir.resolve(key).normalize();
    if (!file.startsWith(baseDir) || file.equals(baseDir)) {
      throw new IllegalArgumentException(
          "key must name a file below " + baseDir + ": " + key);
    }
    return file;
  }
}
