package org.waabox.satellite.shape;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Static utility class for converting {@link Shape} instances to and from
 * Jackson tree nodes.
 *
 * <p>Fields are always written in the same order ({@code tablename},
 * {@code where}, {@code include}). In canonical mode every array, including
 * foreign key column lists, is sorted by the textual form of its elements,
 * which makes the output independent of the order in which includes were
 * declared.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ShapeCodec {

  /** Shared ObjectMapper for tree model operations. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Orders JSON nodes by their serialized form. */
  private static final Comparator<JsonNode> BY_TEXT =
      Comparator.comparing(JsonNode::toString);

  /** Private constructor to prevent instantiation. */
  private ShapeCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Converts a list of shapes into a JSON array.
   *
   * @param shapes    the shapes, never null
   * @param canonical whether arrays must be sorted
   *
   * @return the array node, never null
   */
  public static ArrayNode toArray(final List<Shape> shapes,
      final boolean canonical) {
    Objects.requireNonNull(shapes, "shapes cannot be null");
    final List<JsonNode> nodes = new ArrayList<>(shapes.size());
    for (final Shape shape : shapes) {
      nodes.add(toNode(shape, canonical));
    }
    return arrayOf(nodes, canonical);
  }

  /**
   * Converts a single shape into a JSON object.
   *
   * @param shape     the shape, never null
   * @param canonical whether arrays must be sorted
   *
   * @return the object node, never null
   */
  public static ObjectNode toNode(final Shape shape, final boolean canonical) {
    Objects.requireNonNull(shape, "shape cannot be null");

    final ObjectNode node = MAPPER.createObjectNode();
    node.put("tablename", shape.tablename());
    if (shape.where() != null) {
      node.put("where", shape.where());
    }
    if (!shape.include().isEmpty()) {
      final List<JsonNode> includes = new ArrayList<>();
      for (final ShapeInclude include : shape.include()) {
        final ObjectNode includeNode = MAPPER.createObjectNode();
        final List<JsonNode> columns = new ArrayList<>();
        for (final String column : include.foreignKey()) {
          columns.add(MAPPER.getNodeFactory().textNode(column));
        }
        includeNode.set("foreignKey", arrayOf(columns, canonical));
        includeNode.set("select", toNode(include.select(), canonical));
        includes.add(includeNode);
      }
      node.set("include", arrayOf(includes, canonical));
    }
    return node;
  }

  /**
   * Reads a list of shapes from a JSON array.
   *
   * @param node the array node, never null
   *
   * @return the shapes, never null
   *
   * @throws IllegalArgumentException if the node is not a valid shape array
   */
  public static List<Shape> fromArray(final JsonNode node) {
    Objects.requireNonNull(node, "node cannot be null");
    if (!node.isArray()) {
      throw new IllegalArgumentException("Expected a shape array: " + node);
    }
    final List<Shape> shapes = new ArrayList<>(node.size());
    for (final JsonNode element : node) {
      shapes.add(fromNode(element));
    }
    return shapes;
  }

  /**
   * Reads a single shape from a JSON object.
   *
   * @param node the object node, never null
   *
   * @return the shape, never null
   *
   * @throws IllegalArgumentException if the node is not a valid shape
   */
  public static Shape fromNode(final JsonNode node) {
    final JsonNode tablename = node.get("tablename");
    if (tablename == null || !tablename.isTextual()) {
      throw new IllegalArgumentException("Missing field: tablename in JSON: "
          + node);
    }
    final JsonNode where = node.get("where");

    final List<ShapeInclude> includes = new ArrayList<>();
    final JsonNode includeNode = node.get("include");
    if (includeNode != null && includeNode.isArray()) {
      for (final JsonNode include : includeNode) {
        final List<String> foreignKey = new ArrayList<>();
        final JsonNode columns = include.path("foreignKey");
        for (final JsonNode column : columns) {
          foreignKey.add(column.asText());
        }
        final JsonNode select = include.get("select");
        if (select == null) {
          throw new IllegalArgumentException(
              "Missing field: select in JSON: " + include);
        }
        includes.add(new ShapeInclude(foreignKey, fromNode(select)));
      }
    }

    return new Shape(tablename.asText(),
        where == null || where.isNull() ? null : where.asText(), includes);
  }

  /**
   * Builds an array node from the given elements.
   *
   * @param elements  the elements, never null
   * @param canonical whether to sort the elements
   *
   * @return the array node, never null
   */
  private static ArrayNode arrayOf(final List<JsonNode> elements,
      final boolean canonical) {
    if (canonical) {
      elements.sort(BY_TEXT);
    }
    final ArrayNode array = MAPPER.createArrayNode();
    array.addAll(elements);
    return array;
  }
}
