package dev.gcr.cassette;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import dev.gcr.exceptions.CorruptCassetteException;
import dev.gcr.model.Request;
import dev.gcr.model.Response;
import java.util.Objects;

/** One recorded (request, response) pair. */
public final class CassetteEntry {

  private final Request request;
  private final Response response;

  /**
   * Creates an entry.
   *
   * @param request the normalized request
   * @param response the normalized response
   */
  public CassetteEntry(Request request, Response response) {
    this.request = Objects.requireNonNull(request, "request cannot be null");
    this.response = Objects.requireNonNull(response, "response cannot be null");
  }

  /**
   * Reads an entry from its 2-element array form.
   *
   * @param json the serialized pair
   * @return the entry
   */
  static CassetteEntry fromJson(JsonElement json) {
    if (json == null || !json.isJsonArray() || json.getAsJsonArray().size() != 2) {
      throw new CorruptCassetteException("Cassette entry must be a [request, response] pair");
    }
    JsonArray pair = json.getAsJsonArray();
    return new CassetteEntry(Request.fromJson(pair.get(0)), Response.fromJson(pair.get(1)));
  }

  /**
   * Writes this entry as a 2-element array.
   *
   * @return the serialized pair
   */
  JsonArray toJson() {
    JsonArray pair = new JsonArray();
    pair.add(request.toJson());
    pair.add(response.toJson());
    return pair;
  }

  /**
   * Gets the recorded request.
   *
   * @return the request
   */
  public Request getRequest() {
    return request;
  }

  /**
   * Gets the recorded response.
   *
   * @return the response
   */
  public Response getResponse() {
    return response;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CassetteEntry)) {
      return false;
    }
    CassetteEntry other = (CassetteEntry) o;
    return request.equals(other.request) && response.equals(other.response);
  }

  @Override
  public int hashCode() {
    return Objects.hash(request, response);
  }
}
