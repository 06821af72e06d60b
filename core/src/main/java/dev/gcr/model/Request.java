package dev.gcr.model;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import dev.gcr.exceptions.CorruptCassetteException;
import dev.gcr.stub.RpcCall;
import dev.gcr.utils.JsonSupport;
import java.util.Objects;

/**
 * A normalized, order-independent representation of one RPC call: the method name plus the request
 * message flattened into a JSON object.
 *
 * <p>Instances are immutable. {@link #equals(Object)} is strict structural equality; matching that
 * honors ignored fields is done by {@link RequestMatcher}.
 */
public final class Request {

  static final String METHOD_FIELD = "method";
  static final String ARGS_FIELD = "args";
  static final String VALUE_FIELD = "value";

  private final String method;
  private final JsonObject args;

  private Request(String method, JsonObject args) {
    this.method = Objects.requireNonNull(method, "method cannot be null");
    this.args = args.deepCopy();
  }

  /**
   * Normalizes an intercepted call.
   *
   * <p>The request message is converted to a JSON tree with Gson. Messages that are not JSON
   * objects (strings, numbers, arrays) are wrapped as {@code {"value": ...}}.
   *
   * @param call the intercepted call
   * @return the normalized request
   */
  public static Request fromCall(RpcCall call) {
    return of(call.getMethod(), JsonSupport.GSON.toJsonTree(call.getRequest()));
  }

  /**
   * Creates a request from a method name and an already normalized argument tree.
   *
   * @param method the RPC method name
   * @param args the argument tree
   * @return the request
   */
  public static Request of(String method, JsonElement args) {
    if (args != null && args.isJsonObject()) {
      return new Request(method, args.getAsJsonObject());
    }
    JsonObject wrapped = new JsonObject();
    wrapped.add(VALUE_FIELD, args);
    return new Request(method, wrapped);
  }

  /**
   * Reads a request from its serialized cassette form.
   *
   * @param json the serialized request
   * @return the request
   * @throws CorruptCassetteException if the element is not a valid serialized request
   */
  public static Request fromJson(JsonElement json) {
    if (json == null || !json.isJsonObject()) {
      throw new CorruptCassetteException("Serialized request must be an object: " + json);
    }
    JsonObject obj = json.getAsJsonObject();
    JsonElement method = obj.get(METHOD_FIELD);
    JsonElement args = obj.get(ARGS_FIELD);
    if (method == null || !method.isJsonPrimitive() || args == null || !args.isJsonObject()) {
      throw new CorruptCassetteException("Serialized request needs 'method' and 'args': " + json);
    }
    return new Request(method.getAsString(), args.getAsJsonObject());
  }

  /**
   * Serializes this request to its cassette form.
   *
   * @return {@code {"method": ..., "args": {...}}}
   */
  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    json.addProperty(METHOD_FIELD, method);
    json.add(ARGS_FIELD, args.deepCopy());
    return json;
  }

  /**
   * Gets the RPC method name.
   *
   * @return the method name
   */
  public String getMethod() {
    return method;
  }

  /**
   * Gets a copy of the normalized arguments.
   *
   * @return the argument tree
   */
  public JsonObject getArgs() {
    return args.deepCopy();
  }

  JsonObject argsView() {
    return args;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Request)) {
      return false;
    }
    Request other = (Request) o;
    return method.equals(other.method) && JsonSupport.jsonEquals(args, other.args);
  }

  @Override
  public int hashCode() {
    return 31 * method.hashCode() + JsonSupport.jsonHash(args);
  }

  @Override
  public String toString() {
    return method + " " + JsonSupport.GSON.toJson(args);
  }
}
