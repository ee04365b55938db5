package org.waabox.satellite.state.fs;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.satellite.snapshot.SubscriptionSnapshot;
import org.waabox.satellite.snapshot.SubscriptionSnapshotCodec;
import org.waabox.satellite.snapshot.SubscriptionStateStore;

/**
 * A {@link SubscriptionStateStore} that keeps one JSON file per session
 * under a base directory.
 *
 * <p>Writes go to a temporary file that is then atomically moved over the
 * previous one, so a crash mid-write leaves the previous state intact.
 *
 * <p>Storage layout:
 * <pre>
 * {baseDir}/
 *   {sessionName}.json
 * </pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FileSystemSubscriptionStateStore
    implements SubscriptionStateStore {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(FileSystemSubscriptionStateStore.class);

  /** The extension of the state files. */
  private static final String EXTENSION = ".json";

  /** The base directory where all session files are stored. */
  private final Path baseDir;

  /**
   * Creates a new store, creating the base directory if needed.
   *
   * @param theBaseDir the base directory, never null
   *
   * @throws UncheckedIOException if the directory cannot be created
   */
  public FileSystemSubscriptionStateStore(final Path theBaseDir) {
    baseDir = Objects.requireNonNull(theBaseDir, "baseDir must not be null");
    try {
      Files.createDirectories(baseDir);
    } catch (final IOException e) {
      throw new UncheckedIOException(
          "Failed to create base directory: " + baseDir, e);
    }
  }

  /**
   * {@inheritDoc}
   *
   * @throws UncheckedIOException if writing to the filesystem fails
   */
  @Override
  public void save(final String sessionName,
      final SubscriptionSnapshot snapshot) {
    Objects.requireNonNull(snapshot, "snapshot must not be null");
    final Path file = fileFor(sessionName);
    final Path temp = baseDir.resolve(file.getFileName() + ".tmp");
    try {
      Files.writeString(temp, SubscriptionSnapshotCodec.serialize(snapshot),
          StandardCharsets.UTF_8);
      Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING,
          StandardCopyOption.ATOMIC_MOVE);
      log.debug("Saved {} subscriptions for session '{}'",
          snapshot.subscriptions().size(), sessionName);
    } catch (final IOException e) {
      throw new UncheckedIOException(
          "Failed to save subscriptions for session: " + sessionName, e);
    }
  }

  /**
   * {@inheritDoc}
   *
   * @throws UncheckedIOException     if reading from the filesystem fails
   * @throws IllegalArgumentException if the stored file is not a valid
   *                                  snapshot
   */
  @Override
  public Optional<SubscriptionSnapshot> load(final String sessionName) {
    final Path file = fileFor(sessionName);
    if (!Files.exists(file)) {
      return Optional.empty();
    }
    try {
      final String json = Files.readString(file, StandardCharsets.UTF_8);
      return Optional.of(SubscriptionSnapshotCodec.deserialize(json));
    } catch (final IOException e) {
      throw new UncheckedIOException(
          "Failed to load subscriptions for session: " + sessionName, e);
    }
  }

  /**
   * Resolves the file of a session.
   *
   * @param sessionName the session name, never null
   *
   * @return the file path, never null
   *
   * @throws IllegalArgumentException if the name would escape the base
   *                                  directory
   */
  private Path fileFor(final String sessionName) {
    Objects.requireNonNull(sessionName, "sessionName must not be null");
    if (sessionName.isBlank() || sessionName.contains("/")
        || sessionName.contains("\\") || sessionName.startsWith(".")) {
      throw new IllegalArgumentException(
          "Invalid session name: '" + sessionName + "'");
    }
    return baseDir.resolve(sessionName + EXTENSION);
  }
}
