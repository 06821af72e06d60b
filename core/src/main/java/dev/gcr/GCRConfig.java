package dev.gcr;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import dev.gcr.exceptions.ConfigException;
import dev.gcr.exceptions.RunningException;
import dev.gcr.stub.StubHandle;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-wide GCR settings: where cassettes live, which stubs to intercept and which request
 * fields never take part in matching.
 *
 * <p>Settings are "set before use". While a cassette session is bound every mutator fails with
 * {@link RunningException}.
 *
 * <p>The directory and ignore list can also be read from YAML:
 *
 * <pre>{@code
 * cassette_dir: src/test/resources/cassettes
 * ignore:
 *   - request_id
 *   - auth_token
 * }</pre>
 */
public final class GCRConfig {

  private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

  static final String CASSETTE_DIR_KEY = "cassette_dir";
  static final String IGNORE_KEY = "ignore";

  private volatile Path cassetteDir;
  private final Set<StubHandle> stubs = Collections.synchronizedSet(new LinkedHashSet<>());
  private final Set<String> ignoredFields = Collections.synchronizedSet(new LinkedHashSet<>());
  private final AtomicBoolean running = new AtomicBoolean();

  /**
   * Create GCRConfig from a YAML string
   *
   * @param yaml the YAML document
   * @return a config with the directory and ignore list set
   */
  public static GCRConfig fromYaml(String yaml) {
    try {
      return fromMap(YAML_MAPPER.readValue(yaml, Map.class));
    } catch (JsonProcessingException e) {
      throw new ConfigException("Failed to parse GCR YAML config: " + e.getOriginalMessage());
    }
  }

  /**
   * Create GCRConfig from a YAML file
   *
   * @param file the YAML file
   * @return a config with the directory and ignore list set
   */
  public static GCRConfig fromYamlFile(Path file) {
    try {
      return fromMap(YAML_MAPPER.readValue(file.toFile(), Map.class));
    } catch (IOException e) {
      throw new ConfigException("Failed to read GCR YAML config from " + file + ": " + e);
    }
  }

  private static GCRConfig fromMap(Map<?, ?> data) {
    GCRConfig config = new GCRConfig();
    if (data == null) {
      return config;
    }
    Object dir = data.get(CASSETTE_DIR_KEY);
    if (dir != null) {
      config.setCassetteDir(Path.of(dir.toString()));
    }
    Object ignore = data.get(IGNORE_KEY);
    if (ignore instanceof List<?> fields) {
      for (Object field : fields) {
        config.ignore(String.valueOf(field));
      }
    } else if (ignore != null) {
      throw new ConfigException("'" + IGNORE_KEY + "' must be a list of field names");
    }
    return config;
  }

  /**
   * Sets where cassettes are stored.
   *
   * @param cassetteDir the cassette directory
   */
  public void setCassetteDir(Path cassetteDir) {
    checkNotRunning();
    this.cassetteDir = cassetteDir;
  }

  /**
   * Gets where cassettes are stored.
   *
   * @return the cassette directory
   * @throws ConfigException if no directory is configured
   */
  public Path getCassetteDir() {
    Path dir = cassetteDir;
    if (dir == null) {
      throw new ConfigException("no cassette dir configured");
    }
    return dir;
  }

  /**
   * Adds a stub to intercept.
   *
   * @param stub the stub handle
   */
  public void addStub(StubHandle stub) {
    checkNotRunning();
    stubs.add(stub);
  }

  /** Forgets every configured stub. */
  public void resetStubs() {
    checkNotRunning();
    stubs.clear();
  }

  /**
   * Gets the stubs to intercept, in the order they were added.
   *
   * @return a snapshot of the stub handles
   * @throws ConfigException if no stub is configured
   */
  public List<StubHandle> getStubs() {
    List<StubHandle> snapshot;
    synchronized (stubs) {
      snapshot = new ArrayList<>(stubs);
    }
    if (snapshot.isEmpty()) {
      throw new ConfigException("no stubs configured");
    }
    return snapshot;
  }

  /**
   * Ignores fields when matching requests.
   *
   * @param fields field names (e.g. "token")
   */
  public void ignore(String... fields) {
    checkNotRunning();
    Collections.addAll(ignoredFields, fields);
  }

  /**
   * Gets the globally ignored field names.
   *
   * @return an immutable copy of the field names
   */
  public Set<String> getIgnoredFields() {
    synchronized (ignoredFields) {
      return Set.copyOf(ignoredFields);
    }
  }

  /**
   * Checks whether a session currently holds this config.
   *
   * @return true while a session is bound
   */
  public boolean isRunning() {
    return running.get();
  }

  void markRunning(boolean value) {
    running.set(value);
  }

  private void checkNotRunning() {
    if (running.get()) {
      throw new RunningException("cannot configure GCR while a cassette session is active");
    }
  }
}
