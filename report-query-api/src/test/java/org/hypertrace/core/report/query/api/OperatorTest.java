package org.hypertrace.core.report.query.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class OperatorTest {

  @Test
  void resolvesKeys() {
    assertEquals(Operator.NOT_EMPTY, Operator.fromKey("notEmpty"));
    assertEquals(Operator.NOT_IN, Operator.fromKey("notIn"));
    assertThrows(IllegalArgumentException.class, () -> Operator.fromKey("NOTEMPTY"));
  }

  @Test
  void shapesLikePatterns() {
    assertEquals("abc%", Operator.STARTS_WITH.toLikePattern("abc"));
    assertEquals("%abc", Operator.ENDS_WITH.toLikePattern("abc"));
    assertEquals("%abc%", Operator.CONTAINS.toLikePattern("abc"));
    assertEquals("abc", Operator.EQ.toLikePattern("abc"));
  }

  @Test
  void mapsTypesToOperatorGroups() {
    assertEquals(OperatorGroup.BOOL, SemanticType.fromKey("boolean").getOperatorGroup());
    assertEquals(OperatorGroup.INT, SemanticType.fromKey("float").getOperatorGroup());
    assertEquals(OperatorGroup.TEXT, SemanticType.fromKey("url").getOperatorGroup());
    assertEquals(OperatorGroup.DEFAULT, SemanticType.fromKey("datetime").getOperatorGroup());
    assertTrue(SemanticType.DATE.isTemporal());
    assertFalse(SemanticType.TIME.isTemporal());
  }
}
