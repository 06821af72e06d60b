package dev.gcr.model;

import dev.gcr.utils.JsonSupport;
import java.util.Collection;
import java.util.Set;

/**
 * Decides whether two requests are the same logical call.
 *
 * <p>Two requests match when they name the same method and their argument trees are equal once
 * every ignored field name is removed, at any depth. The ignored set is the union of the global
 * ignore list and the session's own list.
 */
public final class RequestMatcher {

  private final Set<String> ignoredFields;

  /**
   * Creates a matcher.
   *
   * @param ignoredFields field names skipped when comparing arguments
   */
  public RequestMatcher(Collection<String> ignoredFields) {
    this.ignoredFields = Set.copyOf(ignoredFields);
  }

  /**
   * Creates a matcher that ignores nothing.
   *
   * @return a strict matcher
   */
  public static RequestMatcher strict() {
    return new RequestMatcher(Set.of());
  }

  /**
   * Checks whether two requests match under this matcher's ignore rules.
   *
   * @param a the first request
   * @param b the second request
   * @return true if the requests are the same logical call
   */
  public boolean matches(Request a, Request b) {
    if (!a.getMethod().equals(b.getMethod())) {
      return false;
    }
    if (ignoredFields.isEmpty()) {
      return JsonSupport.jsonEquals(a.argsView(), b.argsView());
    }
    return JsonSupport.jsonEquals(
        JsonSupport.withoutFields(a.argsView(), ignoredFields),
        JsonSupport.withoutFields(b.argsView(), ignoredFields));
  }

  /**
   * Gets the ignored field names.
   *
   * @return an immutable set of field names
   */
  public Set<String> getIgnoredFields() {
    return ignoredFields;
  }
}
