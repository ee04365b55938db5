package org.waabox.satellite;

import static org.easymock.EasyMock.capture;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.newCapture;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.easymock.Capture;
import org.junit.jupiter.api.Test;
import org.waabox.satellite.adapter.BatchStorageDriver;
import org.waabox.satellite.adapter.DatabaseAdapter;
import org.waabox.satellite.adapter.SerialDatabaseAdapter;
import org.waabox.satellite.pause.PauseListener;
import org.waabox.satellite.shape.Shape;
import org.waabox.satellite.shape.SyncRegistration;
import org.waabox.satellite.shape.SyncStatus;
import org.waabox.satellite.snapshot.ContinuedSubscription;
import org.waabox.satellite.snapshot.SubscriptionSnapshot;
import org.waabox.satellite.snapshot.SubscriptionStateStore;

/**
 * Tests for {@link SatelliteSession}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class SatelliteSessionTest {

  private final DatabaseAdapter adapter =
      new SerialDatabaseAdapter(createMock(BatchStorageDriver.class));

  @Test
  void whenBuilding_givenDefaults_shouldUseDefaultName() {
    final SatelliteSession session = SatelliteSession.builder()
        .adapter(adapter)
        .build();

    assertEquals(SatelliteSession.DEFAULT_NAME, session.name());
    assertEquals(adapter, session.adapter());
  }

  @Test
  void whenBuilding_givenNoAdapter_shouldThrow() {
    assertThrows(IllegalStateException.class,
        () -> SatelliteSession.builder().build());
  }

  @Test
  void whenStarting_givenSavedSubscriptions_shouldRestoreThem() {
    final SubscriptionSnapshot saved = new SubscriptionSnapshot(Map.of(
        "items", new ContinuedSubscription("s1",
            List.of(Shape.of("items")))));

    final SubscriptionStateStore store =
        createMock(SubscriptionStateStore.class);
    expect(store.load("app")).andReturn(Optional.of(saved));
    replay(store);

    final SatelliteSession session = SatelliteSession.builder()
        .name("app")
        .adapter(adapter)
        .stateStore(store)
        .build();
    session.start();

    assertEquals(Optional.of(new SyncStatus.Active("s1")),
        session.subscriptions().status("items"));
    assertEquals(List.of("s1"),
        session.subscriptions().listContinuedSubscriptions());
    verify(store);
  }

  @Test
  void whenStarting_givenTwice_shouldThrow() {
    final SatelliteSession session = SatelliteSession.builder()
        .adapter(adapter)
        .build();
    session.start();

    assertThrows(IllegalStateException.class, session::start);
  }

  @Test
  void whenStopping_givenActiveSubscription_shouldSaveItOnce() {
    final SubscriptionStateStore store =
        createMock(SubscriptionStateStore.class);
    expect(store.load("app")).andReturn(Optional.empty());
    final Capture<SubscriptionSnapshot> saved = newCapture();
    store.save(eq("app"), capture(saved));
    expectLastCall().once();
    replay(store);

    final SatelliteSession session = SatelliteSession.builder()
        .name("app")
        .adapter(adapter)
        .stateStore(store)
        .build();
    session.start();

    final SyncRegistration reg = session.subscriptions().syncRequested(
        List.of(Shape.of("items")), "items");
    reg.setServerId("s1");
    session.subscriptions().dataDelivered("s1").get();

    session.stop();
    session.stop();

    assertEquals(Map.of("items", "s1"), saved.getValue().serverIdsByKey());
    verify(store);
  }

  @Test
  void whenPausing_givenPauseListener_shouldNotifyIt() {
    final int[] pauses = new int[1];
    final SatelliteSession session = SatelliteSession.builder()
        .adapter(adapter)
        .pauseListener(PauseListener.of(
            () -> pauses[0]++, () -> { }))
        .build();

    session.pauseGate().acquire("visibility");

    assertTrue(session.pauseGate().isPaused());
    assertEquals(1, pauses[0]);
  }
}
