package dev.gcr.cassette;

import static org.assertj.core.api.Assertions.assertThat;

import com.google.gson.JsonParser;
import dev.gcr.model.Request;
import dev.gcr.model.RequestMatcher;
import dev.gcr.model.Response;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Cassette")
class CassetteTest {

  private static Request get(int id, String requestId) {
    return Request.of(
        "Get", JsonParser.parseString("{\"id\":" + id + ",\"requestId\":\"" + requestId + "\"}"));
  }

  @Nested
  @DisplayName("Lookup")
  class Lookup {

    @Test
    @DisplayName("should return the first matching entry")
    void shouldReturnFirstMatch() {
      Cassette cassette = new Cassette("first-match");
      cassette.append(get(1, "a"), Response.fromCallResult("first"));
      cassette.append(get(1, "b"), Response.fromCallResult("second"));

      CassetteEntry entry =
          cassette.lookup(get(1, "c"), new RequestMatcher(Set.of("requestId")));

      assertThat(entry).isNotNull();
      assertThat(entry.getResponse().toCallResult()).isEqualTo("first");
    }

    @Test
    @DisplayName("should return null when nothing matches")
    void shouldReturnNullOnMiss() {
      Cassette cassette = new Cassette("miss");
      cassette.append(get(1, "a"), Response.fromCallResult("one"));

      assertThat(cassette.lookup(get(2, "a"), RequestMatcher.strict())).isNull();
    }

    @Test
    @DisplayName("should match regardless of position")
    void shouldMatchAnyPosition() {
      Cassette cassette = new Cassette("positions");
      cassette.append(get(1, "a"), Response.fromCallResult("one"));
      cassette.append(get(2, "a"), Response.fromCallResult("two"));

      assertThat(cassette.lookup(get(2, "a"), RequestMatcher.strict()).getResponse().toCallResult())
          .isEqualTo("two");
      assertThat(cassette.lookup(get(1, "a"), RequestMatcher.strict()).getResponse().toCallResult())
          .isEqualTo("one");
    }
  }

  @Nested
  @DisplayName("Appending")
  class Appending {

    @Test
    @DisplayName("should keep insertion order")
    void shouldKeepInsertionOrder() {
      Cassette cassette = new Cassette("order");
      cassette.append(get(3, "a"), Response.fromCallResult("three"));
      cassette.append(get(1, "a"), Response.fromCallResult("one"));

      assertThat(cassette.getEntries())
          .extracting(e -> e.getRequest().getArgs().get("id").getAsInt())
          .containsExactly(3, 1);
    }

    @Test
    @DisplayName("should not append a request that is already recorded")
    void shouldDeduplicate() {
      Cassette cassette = new Cassette("dedup");
      RequestMatcher matcher = new RequestMatcher(Set.of("requestId"));

      assertThat(cassette.appendIfAbsent(get(1, "a"), Response.fromCallResult("a"), matcher))
          .isTrue();
      assertThat(cassette.appendIfAbsent(get(1, "b"), Response.fromCallResult("b"), matcher))
          .isFalse();

      assertThat(cassette.size()).isEqualTo(1);
      assertThat(cassette.getEntries().get(0).getResponse().toCallResult()).isEqualTo("a");
    }

    @Test
    @DisplayName("should record one entry when many threads append the same request")
    void shouldDeduplicateConcurrently() throws Exception {
      Cassette cassette = new Cassette("concurrent");
      RequestMatcher matcher = RequestMatcher.strict();
      int threads = 8;
      ExecutorService executor = Executors.newFixedThreadPool(threads);
      CountDownLatch start = new CountDownLatch(1);
      try {
        List<Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
          String value = "v" + i;
          results.add(
              executor.submit(
                  () -> {
                    start.await();
                    return cassette.appendIfAbsent(
                        get(1, "a"), Response.fromCallResult(value), matcher);
                  }));
        }
        start.countDown();

        int appended = 0;
        for (Future<Boolean> result : results) {
          if (result.get(10, TimeUnit.SECONDS)) {
            appended++;
          }
        }
        assertThat(appended).isEqualTo(1);
        assertThat(cassette.size()).isEqualTo(1);
      } finally {
        executor.shutdownNow();
      }
    }

    @Test
    @DisplayName("should expose a read-only entry list")
    void shouldExposeReadOnlyEntries() {
      Cassette cassette = new Cassette("read-only");
      cassette.append(get(1, "a"), Response.fromCallResult("one"));

      List<CassetteEntry> entries = cassette.getEntries();

      org.junit.jupiter.api.Assertions.assertThrows(
          UnsupportedOperationException.class, () -> entries.remove(0));
    }
  }
}
