package dev.gcr.utils;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import java.math.BigDecimal;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/** Shared Gson instances and JSON tree helpers used by the model and the cassette store. */
public final class JsonSupport {

  /** Gson used to normalize call arguments and results into JSON trees. */
  public static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

  /** Gson used to write cassette files. */
  public static final Gson PRETTY_GSON =
      new GsonBuilder().disableHtmlEscaping().serializeNulls().setPrettyPrinting().create();

  /**
   * Returns a copy of the element with every object member named in {@code fields} removed, at
   * every nesting level.
   *
   * @param element the element to copy
   * @param fields field names to drop
   * @return the stripped copy
   */
  public static JsonElement withoutFields(JsonElement element, Set<String> fields) {
    if (element == null || element.isJsonNull()) {
      return JsonNull.INSTANCE;
    }
    if (element.isJsonObject()) {
      JsonObject copy = new JsonObject();
      for (Map.Entry<String, JsonElement> member : element.getAsJsonObject().entrySet()) {
        if (!fields.contains(member.getKey())) {
          copy.add(member.getKey(), withoutFields(member.getValue(), fields));
        }
      }
      return copy;
    }
    if (element.isJsonArray()) {
      JsonArray copy = new JsonArray();
      for (JsonElement item : element.getAsJsonArray()) {
        copy.add(withoutFields(item, fields));
      }
      return copy;
    }
    return element.deepCopy();
  }

  /**
   * Structural equality of two JSON trees. Object member order is irrelevant and numbers are equal
   * when they denote the same decimal value, whether they were built from Java numbers or parsed
   * from text.
   *
   * <p>{@link JsonPrimitive#equals(Object)} compares parsed numbers as doubles, which conflates
   * integers above 2^53.
   *
   * @param a the first tree, may be null
   * @param b the second tree, may be null
   * @return true if the trees are equal
   */
  public static boolean jsonEquals(JsonElement a, JsonElement b) {
    JsonElement left = a == null ? JsonNull.INSTANCE : a;
    JsonElement right = b == null ? JsonNull.INSTANCE : b;
    if (left.isJsonNull() || right.isJsonNull()) {
      return left.isJsonNull() && right.isJsonNull();
    }
    if (left.isJsonObject() && right.isJsonObject()) {
      Set<Map.Entry<String, JsonElement>> members = left.getAsJsonObject().entrySet();
      JsonObject other = right.getAsJsonObject();
      if (members.size() != other.size()) {
        return false;
      }
      for (Map.Entry<String, JsonElement> member : members) {
        JsonElement value = other.get(member.getKey());
        if (value == null || !jsonEquals(member.getValue(), value)) {
          return false;
        }
      }
      return true;
    }
    if (left.isJsonArray() && right.isJsonArray()) {
      JsonArray first = left.getAsJsonArray();
      JsonArray second = right.getAsJsonArray();
      if (first.size() != second.size()) {
        return false;
      }
      Iterator<JsonElement> it = second.iterator();
      for (JsonElement item : first) {
        if (!jsonEquals(item, it.next())) {
          return false;
        }
      }
      return true;
    }
    if (left.isJsonPrimitive() && right.isJsonPrimitive()) {
      JsonPrimitive p = left.getAsJsonPrimitive();
      JsonPrimitive q = right.getAsJsonPrimitive();
      if (p.isNumber() && q.isNumber()) {
        return canonicalNumber(p).equals(canonicalNumber(q));
      }
      return p.equals(q);
    }
    return false;
  }

  /**
   * Hash code consistent with {@link #jsonEquals(JsonElement, JsonElement)}.
   *
   * @param element the tree, may be null
   * @return the hash code
   */
  public static int jsonHash(JsonElement element) {
    if (element == null || element.isJsonNull()) {
      return 0;
    }
    if (element.isJsonObject()) {
      int hash = 0;
      for (Map.Entry<String, JsonElement> member : element.getAsJsonObject().entrySet()) {
        hash += member.getKey().hashCode() ^ jsonHash(member.getValue());
      }
      return hash;
    }
    if (element.isJsonArray()) {
      int hash = 1;
      for (JsonElement item : element.getAsJsonArray()) {
        hash = 31 * hash + jsonHash(item);
      }
      return hash;
    }
    JsonPrimitive primitive = element.getAsJsonPrimitive();
    return primitive.isNumber() ? canonicalNumber(primitive).hashCode() : primitive.hashCode();
  }

  private static Object canonicalNumber(JsonPrimitive number) {
    String text = number.getAsString();
    try {
      BigDecimal value = new BigDecimal(text);
      return value.signum() == 0 ? BigDecimal.ZERO : value.stripTrailingZeros();
    } catch (NumberFormatException e) {
      // NaN and Infinity written by a lenient Gson
      return text;
    }
  }

  private JsonSupport() {
    // Prevent instantiation
  }
}
