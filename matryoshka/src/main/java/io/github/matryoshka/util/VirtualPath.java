package io.github.matryoshka.util;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * A normalized path inside the virtual file system.
 *
 * <p>The normalized form is the only key used to address entries: segments are separated by a single
 * {@code /}, there is no leading or trailing slash, {@code .} segments are dropped and {@code ..} removes the
 * previously retained segment (or nothing, if there is none). Normalization never fails.
 */
public final class VirtualPath implements Comparable<VirtualPath> {

  /**
   * The separator between segments.
   */
  public static final String SEPARATOR = "/";

  private static final String CURRENT_DIRECTORY = ".";
  private static final String PARENT_DIRECTORY = "..";

  private final String value;

  private VirtualPath(final String value) {
    this.value = value;
  }

  /**
   * Normalizes a raw path.
   *
   * @param rawPath the raw path
   * @return the virtual path
   */
  public static VirtualPath of(final String rawPath) {
    Objects.requireNonNull(rawPath, "rawPath");
    final Deque<String> segments = new ArrayDeque<>();
    for (String segment : rawPath.split(SEPARATOR)) {
      if (segment.isEmpty() || segment.equals(CURRENT_DIRECTORY)) {
        continue;
      }
      if (segment.equals(PARENT_DIRECTORY)) {
        segments.pollLast();
      } else {
        segments.addLast(segment);
      }
    }
    return new VirtualPath(String.join(SEPARATOR, segments));
  }

  /**
   * The normalized string form, as persisted.
   *
   * @return the value
   */
  public String value() {
    return value;
  }

  /**
   * Checks if the path has no segments left.
   *
   * @return true if the normalized path is empty
   */
  public boolean isEmpty() {
    return value.isEmpty();
  }

  @Override
  public int compareTo(final VirtualPath other) {
    return value.compareTo(other.value);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof VirtualPath)) {
      return false;
    }
    return value.equals(((VirtualPath) o).value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public String toString() {
    return value;
  }

}
