package dev.gcr.model;

import com.google.gson.reflect.TypeToken;
import dev.gcr.exceptions.CorruptCassetteException;
import dev.gcr.exceptions.UnsupportedResultException;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;

/**
 * Names the type of a call result precisely enough for Gson to rebuild it.
 *
 * <p>Plain messages are named by their class. Collections and maps are named by their interface
 * and the runtime class of their elements, e.g. {@code java.util.List<com.acme.Item>}, because the
 * element type is erased from the runtime class. Every element must share one type; null elements
 * and empty nested containers fit any element type.
 */
final class ResultTypes {

  private ResultTypes() {
    // Prevent instantiation
  }

  /**
   * Describes the type of a non-null result.
   *
   * @param value the result
   * @return the type to serialize and rebuild it with
   * @throws UnsupportedResultException if the value cannot be described
   */
  static Type describe(Object value) {
    if (value instanceof Collection<?> collection) {
      Type element = commonType(collection, value);
      return TypeToken.getParameterized(collectionInterface(collection), element).getType();
    }
    if (value instanceof Map<?, ?> map) {
      Type key = commonType(map.keySet(), value);
      Type mapped = commonType(map.values(), value);
      Class<?> raw = map instanceof SortedMap ? SortedMap.class : Map.class;
      return TypeToken.getParameterized(raw, key, mapped).getType();
    }
    Class<?> type = value.getClass();
    if (type.isAnonymousClass() || type.isLocalClass()) {
      throw new UnsupportedResultException(
          "Cannot record a result of anonymous or local class " + type.getName());
    }
    return type;
  }

  /**
   * Renders a type in the form {@link #parse(String, ClassLoader)} reads.
   *
   * @param type the type
   * @return the type name
   */
  static String name(Type type) {
    if (type instanceof ParameterizedType parameterized) {
      StringBuilder name = new StringBuilder(name(parameterized.getRawType())).append('<');
      Type[] arguments = parameterized.getActualTypeArguments();
      for (int i = 0; i < arguments.length; i++) {
        if (i > 0) {
          name.append(',');
        }
        name.append(name(arguments[i]));
      }
      return name.append('>').toString();
    }
    if (type instanceof Class<?> raw) {
      return raw.getName();
    }
    return type.getTypeName();
  }

  /**
   * Reads a type name written by {@link #name(Type)}. Plain class names are accepted as well.
   *
   * @param text the type name
   * @param loader loads the named classes
   * @return the type
   * @throws CorruptCassetteException if the name is malformed or names a missing class
   */
  static Type parse(String text, ClassLoader loader) {
    Parser parser = new Parser(text, loader);
    Type type = parser.type();
    if (parser.pos != text.length()) {
      throw parser.malformed();
    }
    return type;
  }

  private static Class<?> collectionInterface(Collection<?> collection) {
    if (collection instanceof List) {
      return List.class;
    }
    if (collection instanceof SortedSet) {
      return SortedSet.class;
    }
    if (collection instanceof Set) {
      return Set.class;
    }
    if (collection instanceof Queue) {
      return Queue.class;
    }
    return Collection.class;
  }

  private static Type commonType(Collection<?> values, Object container) {
    Type common = null;
    for (Object item : values) {
      if (item == null || isEmptyContainer(item)) {
        continue;
      }
      Type type = describe(item);
      if (common == null) {
        common = type;
      } else if (!common.equals(type)) {
        throw new UnsupportedResultException(
            String.format(
                "Cannot record %s mixing %s and %s elements",
                container.getClass().getName(), name(common), name(type)));
      }
    }
    return common == null ? Object.class : common;
  }

  private static boolean isEmptyContainer(Object item) {
    if (item instanceof Collection<?> collection) {
      return collection.isEmpty();
    }
    return item instanceof Map<?, ?> map && map.isEmpty();
  }

  private static final class Parser {

    private final String text;
    private final ClassLoader loader;
    private int pos;

    Parser(String text, ClassLoader loader) {
      this.text = text;
      this.loader = loader;
    }

    Type type() {
      int start = pos;
      while (pos < text.length() && "<,>".indexOf(text.charAt(pos)) < 0) {
        pos++;
      }
      String className = text.substring(start, pos).trim();
      if (className.isEmpty()) {
        throw malformed();
      }
      Class<?> raw = load(className);
      if (pos == text.length() || text.charAt(pos) != '<') {
        return raw;
      }
      pos++;
      List<Type> arguments = new ArrayList<>();
      while (true) {
        arguments.add(type());
        if (pos == text.length()) {
          throw malformed();
        }
        char next = text.charAt(pos++);
        if (next == '>') {
          break;
        }
        if (next != ',') {
          throw malformed();
        }
      }
      try {
        return TypeToken.getParameterized(raw, arguments.toArray(new Type[0])).getType();
      } catch (IllegalArgumentException e) {
        throw new CorruptCassetteException("Recorded response type is invalid: " + text, e);
      }
    }

    private Class<?> load(String className) {
      try {
        return Class.forName(className, true, loader);
      } catch (ClassNotFoundException e) {
        throw new CorruptCassetteException("Recorded response type not found: " + className, e);
      }
    }

    CorruptCassetteException malformed() {
      return new CorruptCassetteException("Recorded response type is malformed: " + text);
    }
  }
}
