package org.waabox.satellite.snapshot;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.waabox.satellite.shape.ShapeCodec;

/**
 * Static utility class for serializing and deserializing
 * {@link SubscriptionSnapshot} instances to and from JSON strings.
 *
 * <p>Uses Jackson's tree model ({@link JsonNode}). The document has a
 * single {@code subscriptions} object keyed by subscription key:
 *
 * <pre>{@code
 * {"subscriptions":{"projects":{"serverId":"abc","shapes":[{"tablename":"project"}]}}}
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SubscriptionSnapshotCodec {

  /** Shared ObjectMapper for tree model operations. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Private constructor to prevent instantiation. */
  private SubscriptionSnapshotCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Serializes a snapshot into a JSON string.
   *
   * @param snapshot the snapshot to serialize, never null.
   * @return the JSON representation, never null.
   */
  public static String serialize(final SubscriptionSnapshot snapshot) {
    Objects.requireNonNull(snapshot, "snapshot cannot be null");

    final ObjectNode root = MAPPER.createObjectNode();
    final ObjectNode subscriptions = root.putObject("subscriptions");
    snapshot.subscriptions().forEach((key, sub) -> {
      final ObjectNode node = subscriptions.putObject(key);
      node.put("serverId", sub.serverId());
      node.set("shapes", ShapeCodec.toArray(sub.shapes(), false));
    });
    return root.toString();
  }

  /**
   * Deserializes a JSON string into a snapshot.
   *
   * @param json the JSON string to parse, never null.
   * @return the parsed snapshot, never null.
   * @throws IllegalArgumentException if the JSON is malformed or missing
   *     required fields.
   */
  public static SubscriptionSnapshot deserialize(final String json) {
    Objects.requireNonNull(json, "json cannot be null");

    try {
      final JsonNode root = MAPPER.readTree(json);
      final JsonNode subscriptions = requireField(root, "subscriptions");

      final Map<String, ContinuedSubscription> result = new LinkedHashMap<>();
      final Iterator<Map.Entry<String, JsonNode>> fields =
          subscriptions.fields();
      while (fields.hasNext()) {
        final Map.Entry<String, JsonNode> entry = fields.next();
        final JsonNode node = entry.getValue();
        result.put(entry.getKey(), new ContinuedSubscription(
            requireField(node, "serverId").asText(),
            ShapeCodec.fromArray(requireField(node, "shapes"))));
      }
      return new SubscriptionSnapshot(result);
    } catch (final IllegalArgumentException e) {
      throw e;
    } catch (final Exception e) {
      throw new IllegalArgumentException(
          "Failed to deserialize SubscriptionSnapshot from JSON: " + json, e);
    }
  }

  /** Returns the field node for the given key or throws if missing.
   *
   * @param node the parent JSON node.
   * @param field the field name to look up.
   * @return the field node, never null.
   * @throws IllegalArgumentException if the field is missing.
   */
  private static JsonNode requireField(final JsonNode node,
      final String field) {
    final JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      throw new IllegalArgumentException(
          "Missing field: " + field + " in JSON: " + node);
    }
    return value;
  }
}
