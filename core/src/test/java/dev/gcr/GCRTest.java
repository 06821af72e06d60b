package dev.gcr;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.gcr.cassette.Cassette;
import dev.gcr.cassette.CassetteStore;
import dev.gcr.exceptions.CassetteNotFoundException;
import dev.gcr.exceptions.ConfigException;
import dev.gcr.exceptions.NoRecordingFoundException;
import dev.gcr.exceptions.RunningException;
import dev.gcr.exceptions.VersionMismatchException;
import dev.gcr.fixtures.FakeItemsStub;
import dev.gcr.fixtures.GetItemRequest;
import dev.gcr.fixtures.Item;
import dev.gcr.stub.Operation;
import dev.gcr.stub.RpcCall;
import dev.gcr.stub.StubHandle;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("GCR")
class GCRTest {

  @TempDir Path cassetteDir;

  private FakeItemsStub live;
  private StubHandle items;
  private GCRConfig config;
  private GCR gcr;

  @BeforeEach
  void setUp() {
    live = new FakeItemsStub();
    items = new StubHandle("items", live);
    config = new GCRConfig();
    config.setCassetteDir(cassetteDir);
    config.addStub(items);
    config.ignore("requestId");
    gcr = new GCR(config);
  }

  private Item getItem(int id, String requestId) {
    return (Item) items.requestResponse(FakeItemsStub.GET, new GetItemRequest(id, requestId));
  }

  private void assertIdle() {
    assertEquals(GCRMode.IDLE, gcr.getMode());
    assertFalse(items.isIntercepted());
    assertFalse(config.isRunning());
    assertThat(gcr.getActiveCassette()).isNull();
  }

  @Nested
  @DisplayName("Record then play")
  class RecordThenPlay {

    @Test
    @DisplayName("should replay recorded calls without reaching the service")
    void shouldReplayWithoutLiveCalls() {
      gcr.withCassette(
          "get_item",
          () -> {
            assertEquals(GCRMode.RECORDING, gcr.getMode());
            assertEquals(FakeItemsStub.itemFor(1), getItem(1, "first-run"));
          });
      assertIdle();
      assertTrue(gcr.cassetteExists("get_item"));
      assertEquals(1, live.networkCalls.get());

      live.setNameSuffix("-changed");
      gcr.withCassette(
          "get_item",
          () -> {
            assertEquals(GCRMode.PLAYING, gcr.getMode());
            assertEquals(FakeItemsStub.itemFor(1), getItem(1, "second-run"));
            assertThrows(NoRecordingFoundException.class, () -> getItem(2, "second-run"));
          });

      assertIdle();
      assertEquals(1, live.networkCalls.get());
    }

    @Test
    @DisplayName("should not rewrite the cassette while playing")
    void shouldNotWriteWhilePlaying() throws IOException {
      gcr.withCassette("readonly", () -> getItem(1, "a"));
      Path file = new CassetteStore(cassetteDir).pathFor("readonly");
      String recorded = Files.readString(file);

      gcr.withCassette("readonly", () -> getItem(1, "b"));

      assertEquals(recorded, Files.readString(file));
    }

    @Test
    @DisplayName("should replace an existing cassette when recording explicitly")
    void shouldReplaceOnRecord() {
      gcr.withCassette("replace", () -> getItem(1, "a"));

      gcr.enterRecording("replace");
      getItem(2, "a");
      gcr.exitRecording();

      Cassette cassette = new CassetteStore(cassetteDir).load("replace");
      assertEquals(1, cassette.size());
      assertEquals(
          FakeItemsStub.itemFor(2), cassette.getEntries().get(0).getResponse().toCallResult());
    }

    @Test
    @DisplayName("should record and replay deferred calls")
    void shouldReplayDeferredCalls() {
      RpcCall call = RpcCall.deferred(FakeItemsStub.GET, new GetItemRequest(4, "a"));

      gcr.withCassette(
          "deferred",
          () -> {
            Operation operation = (Operation) items.requestResponse(call);
            assertEquals(FakeItemsStub.itemFor(4), operation.execute());
          });
      assertEquals(1, live.networkCalls.get());

      gcr.withCassette(
          "deferred",
          () -> {
            Operation operation =
                (Operation)
                    items.requestResponse(
                        RpcCall.deferred(FakeItemsStub.GET, new GetItemRequest(4, "b")));
            assertEquals(FakeItemsStub.itemFor(4), operation.execute(Item.class));
          });
      assertEquals(1, live.networkCalls.get());
      assertEquals(2, live.operationsCreated.get());
    }
  }

  @Nested
  @DisplayName("Ignored fields")
  class IgnoredFields {

    @Test
    @DisplayName("should match on everything but the session's ignored fields")
    void shouldApplySessionIgnoredFields() {
      GCRConfig strictConfig = new GCRConfig();
      strictConfig.setCassetteDir(cassetteDir);
      strictConfig.addStub(items);
      GCR strict = new GCR(strictConfig);

      strict.withCassette("session_ignore", Set.of("requestId"), () -> getItem(1, "a"));

      strict.withCassette(
          "session_ignore",
          Set.of("requestId"),
          () -> assertEquals(FakeItemsStub.itemFor(1), getItem(1, "b")));
      strict.withCassette(
          "session_ignore",
          () -> assertThrows(NoRecordingFoundException.class, () -> getItem(1, "b")));
      assertEquals(1, live.networkCalls.get());
    }

    @Test
    @DisplayName("should collapse requests differing only in ignored fields while recording")
    void shouldDeduplicateOnIgnoredFields() {
      gcr.withCassette(
          "dedup",
          () -> {
            getItem(1, "a");
            getItem(1, "b");
            getItem(1, "c");
            assertEquals(1, gcr.getActiveCassette().size());
            assertEquals(2, gcr.getActiveSession().getStatistics().getDuplicates());
          });

      assertEquals(3, live.networkCalls.get());
      assertEquals(1, new CassetteStore(cassetteDir).load("dedup").size());
    }
  }

  @Nested
  @DisplayName("Session lifecycle")
  class Lifecycle {

    @Test
    @DisplayName("should leave everything idle when the cassette cannot be loaded")
    void shouldStayIdleOnVersionMismatch() throws IOException {
      Files.writeString(
          cassetteDir.resolve("old.json"),
          "{\"version\": 1, \"recorded_at\": \"2020-01-01T00:00:00Z\", \"reqs\": []}");

      VersionMismatchException e =
          assertThrows(VersionMismatchException.class, () -> gcr.enterPlaying("old"));

      assertEquals(1, e.getFoundVersion());
      assertEquals(CassetteStore.CURRENT_VERSION, e.getExpectedVersion());
      assertIdle();
      assertEquals(FakeItemsStub.itemFor(1), getItem(1, "a"));
    }

    @Test
    @DisplayName("should fail to play a cassette that was never recorded")
    void shouldFailOnMissingCassette() {
      assertThrows(CassetteNotFoundException.class, () -> gcr.enterPlaying("missing"));
      assertIdle();
    }

    @Test
    @DisplayName("should exit and save even when the body throws")
    void shouldExitWhenBodyThrows() {
      IllegalStateException failure =
          assertThrows(
              IllegalStateException.class,
              () ->
                  gcr.withCassette(
                      "failing",
                      () -> {
                        getItem(1, "a");
                        throw new IllegalStateException("boom");
                      }));

      assertEquals("boom", failure.getMessage());
      assertIdle();
      assertEquals(1, new CassetteStore(cassetteDir).load("failing").size());
    }

    @Test
    @DisplayName("should treat a repeated enter as a no-op")
    void shouldIgnoreRepeatedEnter() {
      gcr.enterRecording("repeat");
      gcr.enterRecording("repeat");
      getItem(1, "a");

      assertEquals(1, live.networkCalls.get());
      gcr.exitRecording();

      assertIdle();
      assertEquals(FakeItemsStub.itemFor(2), getItem(2, "a"));
    }

    @Test
    @DisplayName("should treat exits while idle or in the other mode as no-ops")
    void shouldIgnoreStrayExits() {
      gcr.exitRecording();
      gcr.exitPlaying();
      gcr.eject();
      assertIdle();

      gcr.enterRecording("stray");
      gcr.exitPlaying();
      assertEquals(GCRMode.RECORDING, gcr.getMode());
      gcr.exitRecording();
      assertIdle();
    }

    @Test
    @DisplayName("should refuse a second session while one is active")
    void shouldRejectOtherSession() {
      gcr.enterRecording("first");
      try {
        assertThrows(RunningException.class, () -> gcr.enterRecording("second"));
        assertThrows(RunningException.class, () -> gcr.enterPlaying("first"));
        assertEquals("first", gcr.getActiveCassette().getName());
      } finally {
        gcr.exitRecording();
      }
      assertIdle();
    }

    @Test
    @DisplayName("should let a nested block on the same cassette join the outer session")
    void shouldJoinNestedBlock() {
      gcr.withCassette(
          "nested",
          () -> {
            getItem(1, "a");
            gcr.withCassette("nested", () -> getItem(2, "a"));
            assertEquals(GCRMode.RECORDING, gcr.getMode());
            getItem(3, "a");
          });

      assertIdle();
      assertEquals(3, new CassetteStore(cassetteDir).load("nested").size());
    }

    @Test
    @DisplayName("should refuse a nested block ignoring fields the outer session does not")
    void shouldRejectNestedIgnoreWidening() {
      gcr.withCassette(
          "nested_ignore",
          () -> {
            gcr.withCassette("nested_ignore", Set.of("requestId"), () -> getItem(1, "a"));
            RunningException e =
                assertThrows(
                    RunningException.class,
                    () ->
                        gcr.withCassette("nested_ignore", Set.of("token"), () -> getItem(2, "a")));
            assertThat(e.getMessage()).contains("token");
            assertEquals(GCRMode.RECORDING, gcr.getMode());
          });

      assertIdle();
      assertEquals(1, live.networkCalls.get());
      assertEquals(1, new CassetteStore(cassetteDir).load("nested_ignore").size());
    }

    @Test
    @DisplayName("should choose the mode from the cassette on insert")
    void shouldInsertAndEject() {
      gcr.insert("unscoped");
      assertEquals(GCRMode.RECORDING, gcr.getMode());
      getItem(1, "a");
      gcr.eject();
      assertIdle();

      gcr.insert("unscoped");
      assertEquals(GCRMode.PLAYING, gcr.getMode());
      assertEquals(FakeItemsStub.itemFor(1), getItem(1, "b"));
      gcr.eject();
      assertIdle();
      assertEquals(1, live.networkCalls.get());
    }
  }

  @Nested
  @DisplayName("Configuration")
  class Configuration {

    @Test
    @DisplayName("should be locked while a session is active")
    void shouldLockConfigWhileRunning() {
      gcr.withCassette(
          "locked",
          () -> {
            assertTrue(config.isRunning());
            assertThrows(RunningException.class, () -> config.ignore("token"));
            assertThrows(RunningException.class, () -> config.setCassetteDir(cassetteDir));
            assertThrows(RunningException.class, config::resetStubs);
          });

      config.ignore("token");
      assertThat(config.getIgnoredFields()).contains("token", "requestId");
    }

    @Test
    @DisplayName("should fail to start without stubs")
    void shouldRequireStubs() {
      GCRConfig empty = new GCRConfig();
      empty.setCassetteDir(cassetteDir);
      GCR unconfigured = new GCR(empty);

      assertThatThrownBy(() -> unconfigured.enterRecording("x"))
          .isInstanceOf(ConfigException.class)
          .hasMessage("no stubs configured");
      assertEquals(GCRMode.IDLE, unconfigured.getMode());
    }

    @Test
    @DisplayName("should fail to start without a cassette dir")
    void shouldRequireCassetteDir() {
      GCRConfig noDir = new GCRConfig();
      noDir.addStub(items);
      GCR unconfigured = new GCR(noDir);

      assertThrows(ConfigException.class, () -> unconfigured.enterRecording("x"));
      assertEquals(GCRMode.IDLE, unconfigured.getMode());
      assertFalse(items.isIntercepted());
    }
  }

  @Nested
  @DisplayName("Cassette housekeeping")
  class Housekeeping {

    @Test
    @DisplayName("should delete every recorded cassette")
    void shouldDeleteAllCassettes() throws IOException {
      gcr.withCassette("one", () -> getItem(1, "a"));
      gcr.withCassette("two", () -> getItem(2, "a"));
      Files.writeString(cassetteDir.resolve("notes.txt"), "keep me");

      assertEquals(2, gcr.deleteAllCassettes());

      assertFalse(gcr.cassetteExists("one"));
      assertFalse(gcr.cassetteExists("two"));
      assertTrue(Files.exists(cassetteDir.resolve("notes.txt")));
    }

    @Test
    @DisplayName("should refuse to delete cassettes during a session")
    void shouldNotDeleteWhileRunning() {
      gcr.withCassette(
          "busy",
          () -> assertThrows(RunningException.class, () -> gcr.deleteAllCassettes()));
    }
  }
}
