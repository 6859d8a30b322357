package org.hypertrace.core.report.query.sql;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

class CompositeExpressionTest {
  private final ExpressionBuilder expr = new ExpressionBuilder();

  @Test
  void rendersSinglePartWithoutParentheses() {
    assertEquals("a = 1", expr.andX("a = 1").toString());
  }

  @Test
  void nestsCompositesAsRenderedParts() {
    CompositeExpression expression =
        expr.andX(expr.eq("a", ":a")).add(expr.orX(expr.isNull("b"), expr.neq("b", ":b")));
    assertEquals("(a = :a) AND ((b IS NULL) OR (b <> :b))", expression.toString());
  }

  @Test
  void ignoresEmptyParts() {
    CompositeExpression expression = expr.orX().add("").add(expr.andX()).add("c LIKE :c");
    assertEquals(1, expression.count());
    assertEquals("c LIKE :c", expression.toString());
  }

  @Test
  void addsAllComposites() {
    CompositeExpression expression =
        expr.orX().addAll(List.of(expr.andX("a = 1", "b = 2"), expr.andX("c = 3")));
    assertEquals("((a = 1) AND (b = 2)) OR (c = 3)", expression.toString());
  }

  @Test
  void buildsListPredicates() {
    assertEquals("a IN (:p_0, :p_1)", expr.in("a", List.of(":p_0", ":p_1")));
    assertEquals("a NOT IN (:p_0)", expr.notIn("a", List.of(":p_0")));
    assertEquals("'it''s'", expr.literal("it's"));
  }
}
