package org.hypertrace.core.report.query;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.hypertrace.core.report.query.sql.Params;
import org.junit.jupiter.api.Test;

class ReportQueryTest {

  @Test
  void resolvesBoundParamsIntoStatement() {
    ReportQuery reportQuery =
        new ReportQuery(
            "SELECT * FROM t WHERE a = :a AND b = :b AND c LIKE :c AND d > :d AND e = :missing",
            Params.newBuilder()
                .addLongParam("a", 1L)
                .addBooleanParam("b", true)
                .addStringParam("c", "it's%")
                .addDoubleParam("d", 1.5d)
                .build(),
            null);

    assertEquals(
        "SELECT * FROM t WHERE a = 1 AND b = 1 AND c LIKE 'it''s%' AND d > 1.5 AND e = :missing",
        reportQuery.resolveStatement());
  }
}
