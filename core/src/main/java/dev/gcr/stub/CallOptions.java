package dev.gcr.stub;

import java.time.Duration;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** Per-call options passed alongside the request message. */
@Value
@Builder
public class CallOptions {

  /** Options with no deadline, no metadata and an immediate response. */
  public static final CallOptions DEFAULT = CallOptions.builder().build();

  /** Return an unstarted {@link Operation} instead of the response. */
  boolean returnOperation;

  /** Deadline for the call, or null for none. */
  Duration deadline;

  /** Request metadata (headers). Not part of request matching. */
  @Singular("metadataEntry")
  Map<String, String> metadata;
}
