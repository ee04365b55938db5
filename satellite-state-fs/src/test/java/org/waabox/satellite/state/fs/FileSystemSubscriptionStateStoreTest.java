package org.waabox.satellite.state.fs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.waabox.satellite.shape.Shape;
import org.waabox.satellite.snapshot.ContinuedSubscription;
import org.waabox.satellite.snapshot.SubscriptionSnapshot;

/**
 * Tests for {@link FileSystemSubscriptionStateStore}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class FileSystemSubscriptionStateStoreTest {

  @Test
  void whenSavingAndLoading_givenSnapshot_shouldReturnEqualSnapshot(
      @TempDir final Path tempDir) {

    final FileSystemSubscriptionStateStore store =
        new FileSystemSubscriptionStateStore(tempDir);

    final SubscriptionSnapshot snapshot = new SubscriptionSnapshot(Map.of(
        "items", new ContinuedSubscription("s1",
            List.of(Shape.of("items", "status = 'open'")))));

    store.save("app", snapshot);

    assertEquals(Optional.of(snapshot), store.load("app"));
    assertTrue(Files.exists(tempDir.resolve("app.json")));
    assertFalse(Files.exists(tempDir.resolve("app.json.tmp")));
  }

  @Test
  void whenLoading_givenUnknownSession_shouldReturnEmpty(
      @TempDir final Path tempDir) {

    final FileSystemSubscriptionStateStore store =
        new FileSystemSubscriptionStateStore(tempDir);

    assertTrue(store.load("missing").isEmpty());
  }

  @Test
  void whenSaving_givenExistingState_shouldOverwrite(
      @TempDir final Path tempDir) {

    final FileSystemSubscriptionStateStore store =
        new FileSystemSubscriptionStateStore(tempDir);

    store.save("app", new SubscriptionSnapshot(Map.of("items",
        new ContinuedSubscription("s1", List.of(Shape.of("items"))))));
    store.save("app", SubscriptionSnapshot.empty());

    assertTrue(store.load("app").orElseThrow().isEmpty());
  }

  @Test
  void whenCreating_givenMissingDirectory_shouldCreateIt(
      @TempDir final Path tempDir) {

    final Path nested = tempDir.resolve("a").resolve("b");

    new FileSystemSubscriptionStateStore(nested);

    assertTrue(Files.isDirectory(nested));
  }

  @Test
  void whenSaving_givenPathLikeName_shouldThrow(@TempDir final Path tempDir) {
    final FileSystemSubscriptionStateStore store =
        new FileSystemSubscriptionStateStore(tempDir);

    assertThrows(IllegalArgumentException.class,
        () -> store.save("../escape", SubscriptionSnapshot.empty()));
  }

  @Test
  void whenLoading_givenCorruptFile_shouldThrow(@TempDir final Path tempDir)
      throws Exception {
    final FileSystemSubscriptionStateStore store =
        new FileSystemSubscriptionStateStore(tempDir);
    Files.writeString(tempDir.resolve("app.json"), "{broken");

    assertThrows(IllegalArgumentException.class, () -> store.load("app"));
  }
}
