package io.metricwatch.alert.engine.datamodel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import java.util.Objects;

/**
 * Metric key pattern used by notification preferences. Either an exact metric key such as
 * {@code sentry:errors} or a prefix followed by a single trailing wildcard such as {@code
 * stripe:*}. A lone {@code *} matches every metric.
 */
public final class MetricPattern {
  private static final char WILDCARD = '*';

  private final String pattern;
  private final String prefix;
  private final boolean wildcard;

  private MetricPattern(String pattern) {
    this.pattern = pattern;
    this.wildcard = pattern.charAt(pattern.length() - 1) == WILDCARD;
    this.prefix = wildcard ? pattern.substring(0, pattern.length() - 1) : pattern;
  }

  @JsonCreator
  public static MetricPattern of(String pattern) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(pattern), "Metric pattern is empty");
    int wildcardIndex = pattern.indexOf(WILDCARD);
    Preconditions.checkArgument(
        wildcardIndex < 0 || wildcardIndex == pattern.length() - 1,
        "Wildcard is only allowed as the last character of a metric pattern: %s",
        pattern);
    return new MetricPattern(pattern);
  }

  public boolean matches(String metricKey) {
    if (metricKey == null) {
      return false;
    }
    return wildcard ? metricKey.startsWith(prefix) : pattern.equals(metricKey);
  }

  public boolean isWildcard() {
    return wildcard;
  }

  @JsonValue
  public String getPattern() {
    return pattern;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof MetricPattern)) {
      return false;
    }
    return pattern.equals(((MetricPattern) o).pattern);
  }

  @Override
  public int hashCode() {
    return Objects.hash(pattern);
  }

  @Override
  public String toString() {
    return pattern;
  }
}
