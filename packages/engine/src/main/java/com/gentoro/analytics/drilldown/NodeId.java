package com.gentoro.analytics.drilldown;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.gentoro.analytics.exception.InvalidRequestException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Identifier of a drill-down node: the ordered {@code (column, value)} pairs of its drill prefix.
 *
 * <p>Equality and hashing are defined over the pair list, so two ids are equal exactly when they
 * describe the same prefix, whatever characters the values contain.
 *
 * <p>{@link #encode()} gives an external string form for clients. Each pair is written as {@code
 * column=value}, pairs are joined with {@code /}, and the characters {@code \}, {@code /} and
 * {@code =} inside names and values are escaped with a backslash. {@link #decode(String)} is the
 * exact inverse, e.g. {@code Region=East/City=a\/b} is {@code [(Region, East), (City, a/b)]}.
 */
public final class NodeId {
  private static final char PAIR_SEPARATOR = '/';
  private static final char KEY_VALUE_SEPARATOR = '=';
  private static final char ESCAPE = '\\';

  /** One {@code (column, value)} pair of a node id. */
  public record Segment(String column, String value) {
    public Segment {
      Objects.requireNonNull(column, "column");
      Objects.requireNonNull(value, "value");
    }
  }

  private final List<Segment> segments;

  private NodeId(List<Segment> segments) {
    this.segments = segments;
  }

  public static NodeId of(List<Segment> segments) {
    if (segments == null || segments.isEmpty()) {
      throw new IllegalArgumentException("NodeId requires at least one segment");
    }
    return new NodeId(List.copyOf(segments));
  }

  public static NodeId of(String column, String value) {
    return new NodeId(List.of(new Segment(column, value)));
  }

  /** Id of the prefix {@code columns[i] = values[i]} for every position. */
  public static NodeId of(List<String> columns, List<String> values) {
    if (columns.size() != values.size()) {
      throw new IllegalArgumentException(
          "Columns and values differ in size: " + columns.size() + " vs " + values.size());
    }
    List<Segment> segments = new ArrayList<>(columns.size());
    for (int i = 0; i < columns.size(); i++) {
      segments.add(new Segment(columns.get(i), values.get(i)));
    }
    return of(segments);
  }

  /** Id of a child one level deeper. */
  public NodeId child(String column, String value) {
    List<Segment> extended = new ArrayList<>(segments.size() + 1);
    extended.addAll(segments);
    extended.add(new Segment(column, value));
    return new NodeId(Collections.unmodifiableList(extended));
  }

  /** Id of the parent node, or {@code null} for a top-level id. */
  public NodeId parent() {
    if (segments.size() == 1) {
      return null;
    }
    return new NodeId(List.copyOf(segments.subList(0, segments.size() - 1)));
  }

  public List<Segment> segments() {
    return segments;
  }

  /** Number of pairs; a top-level node has depth 1. */
  public int depth() {
    return segments.size();
  }

  public Segment last() {
    return segments.get(segments.size() - 1);
  }

  @JsonValue
  public String encode() {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < segments.size(); i++) {
      if (i > 0) sb.append(PAIR_SEPARATOR);
      Segment segment = segments.get(i);
      escape(segment.column(), sb);
      sb.append(KEY_VALUE_SEPARATOR);
      escape(segment.value(), sb);
    }
    return sb.toString();
  }

  /**
   * Parse the output of {@link #encode()}.
   *
   * @throws InvalidRequestException if the text is not a well-formed encoded id
   */
  @JsonCreator
  public static NodeId decode(String encoded) {
    if (encoded == null || encoded.isEmpty()) {
      throw new InvalidRequestException("Encoded node id must not be empty");
    }
    List<Segment> segments = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    String column = null;
    int n = encoded.length();
    for (int i = 0; i < n; i++) {
      char c = encoded.charAt(i);
      if (c == ESCAPE) {
        if (i + 1 >= n) {
          throw malformed(encoded, "dangling escape");
        }
        char next = encoded.charAt(++i);
        if (next != ESCAPE && next != PAIR_SEPARATOR && next != KEY_VALUE_SEPARATOR) {
          throw malformed(encoded, "invalid escape '\\" + next + "'");
        }
        current.append(next);
      } else if (c == KEY_VALUE_SEPARATOR) {
        if (column != null) {
          throw malformed(encoded, "unescaped '=' in value");
        }
        column = current.toString();
        current.setLength(0);
      } else if (c == PAIR_SEPARATOR) {
        if (column == null) {
          throw malformed(encoded, "pair without '='");
        }
        segments.add(new Segment(column, current.toString()));
        column = null;
        current.setLength(0);
      } else {
        current.append(c);
      }
    }
    if (column == null) {
      throw malformed(encoded, "pair without '='");
    }
    segments.add(new Segment(column, current.toString()));
    return new NodeId(List.copyOf(segments));
  }

  private static void escape(String text, StringBuilder sb) {
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == ESCAPE || c == PAIR_SEPARATOR || c == KEY_VALUE_SEPARATOR) {
        sb.append(ESCAPE);
      }
      sb.append(c);
    }
  }

  private static InvalidRequestException malformed(String encoded, String reason) {
    return new InvalidRequestException("Malformed node id '" + encoded + "': " + reason);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof NodeId other)) return false;
    return segments.equals(other.segments);
  }

  @Override
  public int hashCode() {
    return segments.hashCode();
  }

  @Override
  public String toString() {
    return encode();
  }
}
