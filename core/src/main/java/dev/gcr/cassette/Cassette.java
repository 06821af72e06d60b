package dev.gcr.cassette;

import dev.gcr.model.Request;
import dev.gcr.model.RequestMatcher;
import dev.gcr.model.Response;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A named recording: an ordered list of (request, response) entries.
 *
 * <p>Entry order is insertion order and survives save/load. Lookups are first-match-wins and never
 * block. Appends are serialized so that {@link #appendIfAbsent} is atomic with respect to other
 * appends.
 */
public final class Cassette {

  private final String name;
  private final int version;
  private volatile Instant recordedAt;
  private final List<CassetteEntry> entries;

  /**
   * Creates an empty cassette for recording.
   *
   * @param name the cassette name
   */
  public Cassette(String name) {
    this(name, CassetteStore.CURRENT_VERSION, null, List.of());
  }

  Cassette(String name, int version, Instant recordedAt, List<CassetteEntry> entries) {
    this.name = Objects.requireNonNull(name, "name cannot be null");
    this.version = version;
    this.recordedAt = recordedAt;
    this.entries = new CopyOnWriteArrayList<>(entries);
  }

  /**
   * Finds the first entry whose request matches.
   *
   * @param request the incoming request
   * @param matcher the matching rules
   * @return the first matching entry, or null if none matches
   */
  public CassetteEntry lookup(Request request, RequestMatcher matcher) {
    for (CassetteEntry entry : entries) {
      if (matcher.matches(entry.getRequest(), request)) {
        return entry;
      }
    }
    return null;
  }

  /**
   * Appends an entry at the end.
   *
   * @param request the normalized request
   * @param response the normalized response
   */
  public synchronized void append(Request request, Response response) {
    entries.add(new CassetteEntry(request, response));
  }

  /**
   * Appends an entry unless a matching request is already recorded.
   *
   * @param request the normalized request
   * @param response the normalized response
   * @param matcher the matching rules
   * @return true if appended, false if a matching request was already recorded
   */
  public synchronized boolean appendIfAbsent(
      Request request, Response response, RequestMatcher matcher) {
    if (lookup(request, matcher) != null) {
      return false;
    }
    entries.add(new CassetteEntry(request, response));
    return true;
  }

  /**
   * Gets the entries in stored order.
   *
   * @return an unmodifiable view of the entries
   */
  public List<CassetteEntry> getEntries() {
    return Collections.unmodifiableList(entries);
  }

  /**
   * Gets the number of entries.
   *
   * @return the entry count
   */
  public int size() {
    return entries.size();
  }

  /**
   * Gets the cassette name.
   *
   * @return the name
   */
  public String getName() {
    return name;
  }

  /**
   * Gets the schema version this cassette was read with or will be written with.
   *
   * @return the version tag
   */
  public int getVersion() {
    return version;
  }

  /**
   * Gets when the cassette was last saved.
   *
   * @return the recording timestamp, or null if never saved
   */
  public Instant getRecordedAt() {
    return recordedAt;
  }

  void setRecordedAt(Instant recordedAt) {
    this.recordedAt = recordedAt;
  }

  @Override
  public String toString() {
    return "Cassette{name=" + name + ", entries=" + entries.size() + "}";
  }
}
