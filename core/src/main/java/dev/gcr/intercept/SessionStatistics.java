package dev.gcr.intercept;

import java.util.concurrent.atomic.AtomicLong;

/** Counters collected over one cassette session. */
public final class SessionStatistics {

  private final AtomicLong hits = new AtomicLong();
  private final AtomicLong misses = new AtomicLong();
  private final AtomicLong recorded = new AtomicLong();
  private final AtomicLong duplicates = new AtomicLong();
  private final AtomicLong liveCalls = new AtomicLong();

  /** Records a playback hit. */
  public void recordHit() {
    hits.incrementAndGet();
  }

  /** Records a playback miss. */
  public void recordMiss() {
    misses.incrementAndGet();
  }

  /** Records a newly appended entry. */
  public void recordAppend() {
    recorded.incrementAndGet();
  }

  /** Records a recorded call whose request was already on the cassette. */
  public void recordDuplicate() {
    duplicates.incrementAndGet();
  }

  /** Records a call forwarded to the real service. */
  public void recordLiveCall() {
    liveCalls.incrementAndGet();
  }

  /**
   * Gets the playback hit count.
   *
   * @return number of hits
   */
  public long getHits() {
    return hits.get();
  }

  /**
   * Gets the playback miss count.
   *
   * @return number of misses
   */
  public long getMisses() {
    return misses.get();
  }

  /**
   * Gets the number of entries appended.
   *
   * @return number of recorded entries
   */
  public long getRecorded() {
    return recorded.get();
  }

  /**
   * Gets the number of recorded calls that were already on the cassette.
   *
   * @return number of duplicates
   */
  public long getDuplicates() {
    return duplicates.get();
  }

  /**
   * Gets the number of calls forwarded to the real service.
   *
   * @return number of live calls
   */
  public long getLiveCalls() {
    return liveCalls.get();
  }

  @Override
  public String toString() {
    return String.format(
        "%d hits, %d misses, %d recorded, %d duplicates, %d live calls",
        getHits(), getMisses(), getRecorded(), getDuplicates(), getLiveCalls());
  }
}
