package org.waabox.satellite.shape;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ShapeHasher}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ShapeHasherTest {

  @Test
  void whenHashing_givenSameShapesInAnyOrder_shouldMatch() {
    final Shape items = Shape.of("items").including(
        List.of("owner_id", "tenant_id"), Shape.of("users"));
    final Shape reordered = Shape.of("items").including(
        List.of("tenant_id", "owner_id"), Shape.of("users"));

    assertEquals(
        ShapeHasher.hash(List.of(items, Shape.of("orders"))),
        ShapeHasher.hash(List.of(Shape.of("orders"), reordered)));
  }

  @Test
  void whenHashing_givenDifferentFilter_shouldDiffer() {
    assertNotEquals(
        ShapeHasher.hash(List.of(Shape.of("items"))),
        ShapeHasher.hash(List.of(Shape.of("items", "id > 3"))));
  }

  @Test
  void whenHashing_givenAnyShapes_shouldReturnSha256Hex() {
    final String hash = ShapeHasher.hash(List.of(Shape.of("items")));

    assertEquals(64, hash.length());
    assertEquals(hash, hash.toLowerCase());
  }
}
