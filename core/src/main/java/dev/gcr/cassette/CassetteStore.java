package dev.gcr.cassette;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import dev.gcr.exceptions.CassetteIOException;
import dev.gcr.exceptions.CassetteNotFoundException;
import dev.gcr.exceptions.CorruptCassetteException;
import dev.gcr.exceptions.VersionMismatchException;
import dev.gcr.utils.JsonSupport;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Stores and retrieves cassettes as JSON files in a directory.
 *
 * <p>Each cassette is one file named {@code <name>.json}:
 *
 * <pre>{@code
 * {
 *   "version": 2,
 *   "recorded_at": "2024-05-01T12:00:00Z",
 *   "reqs": [
 *     [ {"method": "...", "args": {...}}, {"type": "...", "result": {...}} ]
 *   ]
 * }
 * }</pre>
 *
 * <p>Saving always rewrites the whole file. Loading is all-or-nothing.
 */
@Slf4j
public class CassetteStore {

  /** Schema version written to, and required from, cassette files. */
  public static final int CURRENT_VERSION = 2;

  /** Cassette file extension. */
  public static final String EXTENSION = ".json";

  static final String VERSION_FIELD = "version";
  static final String RECORDED_AT_FIELD = "recorded_at";
  static final String REQS_FIELD = "reqs";

  private final Path directory;

  /**
   * Creates a store over a cassette directory.
   *
   * @param directory the directory holding cassette files
   */
  public CassetteStore(Path directory) {
    this.directory = Objects.requireNonNull(directory, "directory cannot be null");
  }

  /**
   * Resolves the file a cassette is stored in.
   *
   * @param name the cassette name
   * @return the cassette path
   */
  public Path pathFor(String name) {
    return directory.resolve(name + EXTENSION);
  }

  /**
   * Checks if a cassette exists.
   *
   * @param name the cassette name
   * @return true if the cassette file exists
   */
  public boolean exists(String name) {
    return Files.isRegularFile(pathFor(name));
  }

  /**
   * Loads a cassette.
   *
   * @param name the cassette name
   * @return the fully loaded cassette
   * @throws CassetteNotFoundException if there is no such cassette
   * @throws VersionMismatchException if the file has another schema version
   * @throws CorruptCassetteException if the file cannot be interpreted
   * @throws CassetteIOException if the file cannot be read
   */
  public Cassette load(String name) {
    Path path = pathFor(name);
    if (!Files.exists(path)) {
      throw new CassetteNotFoundException(name, path.toString());
    }

    JsonElement root;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      root = JsonParser.parseReader(reader);
    } catch (IOException e) {
      throw new CassetteIOException("Failed to read cassette " + path, e);
    } catch (JsonParseException e) {
      throw new CorruptCassetteException("Cassette " + path + " is not valid JSON", e);
    }

    if (!root.isJsonObject()) {
      throw new CorruptCassetteException("Cassette " + path + " must contain a JSON object");
    }
    JsonObject data = root.getAsJsonObject();

    int version = readVersion(data, path);
    if (version != CURRENT_VERSION) {
      throw new VersionMismatchException(name, version, CURRENT_VERSION);
    }

    JsonElement reqs = data.get(REQS_FIELD);
    if (reqs == null || !reqs.isJsonArray()) {
      throw new CorruptCassetteException("Cassette " + path + " has no '" + REQS_FIELD + "' list");
    }

    List<CassetteEntry> entries = new ArrayList<>();
    for (JsonElement pair : reqs.getAsJsonArray()) {
      entries.add(CassetteEntry.fromJson(pair));
    }

    Cassette cassette = new Cassette(name, version, readRecordedAt(data), entries);
    log.debug("Loaded cassette {} with {} entries from {}", name, entries.size(), path);
    return cassette;
  }

  /**
   * Persists a cassette, replacing any existing file.
   *
   * @param cassette the cassette to write
   * @throws CassetteIOException if the file cannot be written
   */
  public void save(Cassette cassette) {
    Path path = pathFor(cassette.getName());
    Instant recordedAt = Instant.now();

    JsonObject data = new JsonObject();
    data.addProperty(VERSION_FIELD, CURRENT_VERSION);
    data.addProperty(RECORDED_AT_FIELD, recordedAt.toString());
    JsonArray reqs = new JsonArray();
    for (CassetteEntry entry : cassette.getEntries()) {
      reqs.add(entry.toJson());
    }
    data.add(REQS_FIELD, reqs);

    try {
      Files.createDirectories(directory);
      try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
        JsonSupport.PRETTY_GSON.toJson(data, writer);
      }
    } catch (IOException e) {
      throw new CassetteIOException("Failed to write cassette " + path, e);
    }

    cassette.setRecordedAt(recordedAt);
    log.debug("Saved cassette {} with {} entries to {}", cassette.getName(), reqs.size(), path);
  }

  /**
   * Deletes every cassette file in the directory. Other files are left alone.
   *
   * @return the number of cassettes deleted
   * @throws CassetteIOException if listing or deleting fails
   */
  public int deleteAll() {
    if (!Files.isDirectory(directory)) {
      return 0;
    }
    int deleted = 0;
    try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + EXTENSION)) {
      for (Path file : files) {
        if (Files.isRegularFile(file)) {
          Files.delete(file);
          deleted++;
        }
      }
    } catch (IOException e) {
      throw new CassetteIOException("Failed to delete cassettes in " + directory, e);
    }
    log.info("Deleted {} cassettes from {}", deleted, directory);
    return deleted;
  }

  /**
   * Gets the cassette directory.
   *
   * @return the directory
   */
  public Path getDirectory() {
    return directory;
  }

  private static int readVersion(JsonObject data, Path path) {
    JsonElement version = data.get(VERSION_FIELD);
    if (version == null || !version.isJsonPrimitive() || !version.getAsJsonPrimitive().isNumber()) {
      throw new CorruptCassetteException("Cassette " + path + " has no numeric version");
    }
    try {
      return version.getAsBigDecimal().intValueExact();
    } catch (ArithmeticException | NumberFormatException e) {
      throw new CorruptCassetteException(
          "Cassette " + path + " has a non-integer version " + version, e);
    }
  }

  private static Instant readRecordedAt(JsonObject data) {
    JsonElement recordedAt = data.get(RECORDED_AT_FIELD);
    if (recordedAt == null || !recordedAt.isJsonPrimitive()) {
      if (recordedAt != null && !recordedAt.isJsonNull()) {
        log.debug("Ignoring non-scalar recorded_at value {}", recordedAt);
      }
      return null;
    }
    try {
      return Instant.parse(recordedAt.getAsString());
    } catch (DateTimeParseException e) {
      // recorded_at is informational, tolerate other timestamp formats
      log.debug("Ignoring unparseable recorded_at value {}", recordedAt);
      return null;
    }
  }
}
