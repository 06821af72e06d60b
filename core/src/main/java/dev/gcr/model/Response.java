package dev.gcr.model;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import dev.gcr.exceptions.CorruptCassetteException;
import dev.gcr.exceptions.UnsupportedResultException;
import dev.gcr.utils.JsonSupport;
import java.lang.reflect.Type;
import java.util.Objects;

/**
 * A normalized successful call result: the result's type name and its JSON tree.
 *
 * <p>Collections and maps carry their element types in the type name (e.g. {@code
 * java.util.List<com.acme.Item>}) so that their elements are rebuilt as the recorded classes.
 * Fields declared as {@code Object} or as an interface inside a message are rebuilt with Gson's
 * defaults for untyped JSON.
 *
 * <p>Converting back with {@link #toCallResult()} rebuilds a new, equivalent instance every time,
 * so replayed values never share state with each other.
 */
public final class Response {

  static final String TYPE_FIELD = "type";
  static final String RESULT_FIELD = "result";

  private final String type;
  private final JsonElement result;

  private Response(String type, JsonElement result) {
    this.type = type;
    this.result = result == null ? JsonNull.INSTANCE : result.deepCopy();
  }

  /**
   * Normalizes a call result.
   *
   * @param value the value returned by the transport, may be null
   * @return the normalized response
   * @throws UnsupportedResultException if the value cannot be rebuilt on replay
   */
  public static Response fromCallResult(Object value) {
    if (value == null) {
      return new Response(null, JsonNull.INSTANCE);
    }
    Type type = ResultTypes.describe(value);
    return new Response(ResultTypes.name(type), JsonSupport.GSON.toJsonTree(value, type));
  }

  /**
   * Reads a response from its serialized cassette form.
   *
   * @param json the serialized response
   * @return the response
   * @throws CorruptCassetteException if the element is not a valid serialized response
   */
  public static Response fromJson(JsonElement json) {
    if (json == null || !json.isJsonObject()) {
      throw new CorruptCassetteException("Serialized response must be an object: " + json);
    }
    JsonObject obj = json.getAsJsonObject();
    if (!obj.has(RESULT_FIELD)) {
      throw new CorruptCassetteException("Serialized response needs 'result': " + json);
    }
    JsonElement typeElement = obj.get(TYPE_FIELD);
    String typeName =
        typeElement == null || typeElement.isJsonNull() ? null : typeElement.getAsString();
    return new Response(typeName, obj.get(RESULT_FIELD));
  }

  /**
   * Serializes this response to its cassette form.
   *
   * @return {@code {"type": ..., "result": ...}}
   */
  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    json.addProperty(TYPE_FIELD, type);
    json.add(RESULT_FIELD, result.deepCopy());
    return json;
  }

  /**
   * Rebuilds the transport result.
   *
   * @return a new instance equivalent to the recorded result, or null if null was recorded
   * @throws CorruptCassetteException if the recorded type cannot be loaded or decoded
   */
  public Object toCallResult() {
    if (type == null) {
      return null;
    }
    Type resultType = ResultTypes.parse(type, classLoader());
    try {
      return JsonSupport.GSON.fromJson(result, resultType);
    } catch (JsonParseException e) {
      throw new CorruptCassetteException("Recorded response cannot be decoded as " + type, e);
    }
  }

  private static ClassLoader classLoader() {
    ClassLoader context = Thread.currentThread().getContextClassLoader();
    return context != null ? context : Response.class.getClassLoader();
  }

  /**
   * Gets the recorded result type name.
   *
   * @return the type name, or null for a null result
   */
  public String getType() {
    return type;
  }

  /**
   * Gets a copy of the recorded result tree.
   *
   * @return the result tree
   */
  public JsonElement getResult() {
    return result.deepCopy();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Response)) {
      return false;
    }
    Response other = (Response) o;
    return Objects.equals(type, other.type) && JsonSupport.jsonEquals(result, other.result);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hashCode(type) + JsonSupport.jsonHash(result);
  }

  @Override
  public String toString() {
    return "Response{type=" + type + ", result=" + JsonSupport.GSON.toJson(result) + "}";
  }
}
