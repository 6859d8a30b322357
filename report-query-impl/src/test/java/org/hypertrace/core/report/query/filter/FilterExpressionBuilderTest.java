package org.hypertrace.core.report.query.filter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.hypertrace.core.report.query.api.FilterDefinition;
import org.hypertrace.core.report.query.api.FilterInstance;
import org.hypertrace.core.report.query.api.Glue;
import org.hypertrace.core.report.query.api.Operator;
import org.hypertrace.core.report.query.api.SemanticType;
import org.hypertrace.core.report.query.sql.CompositeExpression;
import org.hypertrace.core.report.query.sql.Params;
import org.hypertrace.core.report.query.sql.ReportQueryBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FilterExpressionBuilderTest {

  private static final Map<String, FilterDefinition> DEFINITIONS =
      Map.of(
          "e.subject", definition(SemanticType.STRING),
          "e.date_sent", definition(SemanticType.DATETIME),
          "e.is_published", definition(SemanticType.BOOL),
          "es.open_count", definition(SemanticType.INT),
          "es.read_ratio", definition(SemanticType.FLOAT),
          "e.lang", definition(SemanticType.MULTISELECT),
          "read_delay",
          FilterDefinition.builder()
              .type(SemanticType.INT)
              .formula("TIMESTAMPDIFF(SECOND, es.date_sent, es.date_read)")
              .build());

  private final FilterExpressionBuilder filterExpressionBuilder = new FilterExpressionBuilder();
  private ReportQueryBuilder queryBuilder;

  @BeforeEach
  void setup() {
    queryBuilder = new ReportQueryBuilder().select("e.id").from("emails", "e");
  }

  @Test
  void bindsEqualityValueUnderIndexedParamName() {
    assertEquals("e.subject = :i0cesubject", build(filter("e.subject", Operator.EQ, "Welcome")));
    assertEquals("Welcome", params().getStringParams().get("i0cesubject"));
  }

  @Test
  void notEqualsAlsoMatchesNull() {
    assertEquals(
        "(e.subject IS NULL) OR (e.subject <> :i0cesubject)",
        build(filter("e.subject", Operator.NEQ, "Welcome")));
  }

  @Test
  void notEqualsKeepsBlankValue() {
    assertEquals(
        "(e.subject IS NULL) OR (e.subject <> :i0cesubject)",
        build(filter("e.subject", Operator.NEQ, "")));
    assertEquals("", params().getStringParams().get("i0cesubject"));
  }

  @Test
  void notLikeAndNotInDoNotMatchNull() {
    assertEquals(
        "e.subject NOT LIKE :i0cesubject", build(filter("e.subject", Operator.NOT_LIKE, "%promo%")));

    setup();
    FilterInstance notIn =
        filter("e.lang", Operator.NOT_IN, null).toBuilder().values(List.of("en")).build();
    assertEquals("e.lang NOT IN (:i0celang_0)", build(notIn));
  }

  @Test
  void skipsBlankValues() {
    assertTrue(
        filterExpressionBuilder
            .build(
                List.of(
                    filter("e.subject", Operator.EQ, "  "),
                    filter("es.open_count", Operator.GT, null)),
                DEFINITIONS,
                queryBuilder)
            .isEmpty());
    assertEquals(0, params().size());
  }

  @Test
  void notEmptyExcludesEmptyStringUnlessTemporal() {
    assertEquals(
        "(e.subject IS NOT NULL) AND (e.subject <> '')",
        build(filter("e.subject", Operator.NOT_EMPTY, null)));

    setup();
    assertEquals("e.date_sent IS NOT NULL", build(filter("e.date_sent", Operator.NOT_EMPTY, null)));
  }

  @Test
  void emptyMatchesEmptyStringUnlessTemporal() {
    assertEquals(
        "(e.subject IS NULL) OR (e.subject = '')",
        build(filter("e.subject", Operator.EMPTY, null)));

    setup();
    assertEquals("e.date_sent IS NULL", build(filter("e.date_sent", Operator.EMPTY, null)));
    assertEquals(0, params().size());
  }

  @Test
  void substringOperatorsBecomeLikeWithWildcards() {
    assertEquals(
        "(e.subject LIKE :i0cesubject) AND (e.subject LIKE :i1cesubject) AND (e.subject LIKE"
            + " :i2cesubject)",
        build(
            filter("e.subject", Operator.STARTS_WITH, "abc"),
            filter("e.subject", Operator.ENDS_WITH, "abc"),
            filter("e.subject", Operator.CONTAINS, "abc")));

    Map<String, String> stringParams = params().getStringParams();
    assertEquals("abc%", stringParams.get("i0cesubject"));
    assertEquals("%abc", stringParams.get("i1cesubject"));
    assertEquals("%abc%", stringParams.get("i2cesubject"));
  }

  @Test
  void likeBindsValueAsGiven() {
    assertEquals("e.subject LIKE :i0cesubject", build(filter("e.subject", Operator.LIKE, "a_c")));
    assertEquals("a_c", params().getStringParams().get("i0cesubject"));
  }

  @Test
  void booleanResetValueIsSkipped() {
    assertTrue(
        filterExpressionBuilder
            .build(List.of(filter("e.is_published", Operator.EQ, "2")), DEFINITIONS, queryBuilder)
            .isEmpty());
  }

  @Test
  void booleanValuesAreBoundAsBooleans() {
    assertEquals(
        "(e.is_published = :i0ceispublished) AND (e.is_published = :i1ceispublished)",
        build(filter("e.is_published", Operator.EQ, "1"), filter("e.is_published", Operator.EQ, "0")));
    assertEquals(true, params().getBooleanParams().get("i0ceispublished"));
    assertEquals(false, params().getBooleanParams().get("i1ceispublished"));
  }

  @Test
  void numericValuesAreCoercedLeniently() {
    build(
        filter("es.open_count", Operator.GTE, "12abc"),
        filter("es.read_ratio", Operator.LT, "0.75"),
        filter("es.open_count", Operator.LTE, "abc"));

    Params params = params();
    assertEquals(12L, params.getLongParams().get("i0cesopencount"));
    assertEquals(0.75d, params.getDoubleParams().get("i1cesreadratio"));
    assertEquals(0L, params.getLongParams().get("i2cesopencount"));
  }

  @Test
  void formulaReplacesColumnReference() {
    assertEquals(
        "TIMESTAMPDIFF(SECOND, es.date_sent, es.date_read) > :i0creaddelay",
        build(filter("read_delay", Operator.GT, "60")));
    assertEquals(60L, params().getLongParams().get("i0creaddelay"));
  }

  @Test
  void orGlueStartsANewGroup() {
    assertEquals(
        "(e.subject = :i0cesubject) OR ((es.open_count > :i1cesopencount) AND (e.is_published ="
            + " :i2ceispublished))",
        build(
            filter("e.subject", Operator.EQ, "a"),
            filter("es.open_count", Operator.GT, "3").toBuilder().glue(Glue.OR).build(),
            filter("e.is_published", Operator.EQ, "1")));
  }

  @Test
  void leadingOrGlueDoesNotOpenAnEmptyGroup() {
    assertEquals(
        "(e.subject = :i0cesubject) AND (es.open_count > :i1cesopencount)",
        build(
            filter("e.subject", Operator.EQ, "a").toBuilder().glue(Glue.OR).build(),
            filter("es.open_count", Operator.GT, "3")));
  }

  @Test
  void skippedFiltersLeaveNoEmptyGroup() {
    assertEquals(
        "e.subject = :i0cesubject",
        build(
            filter("e.subject", Operator.EQ, "a"),
            filter("es.open_count", Operator.GT, "").toBuilder().glue(Glue.OR).build()));
  }

  @Test
  void inBindsOneParamPerValue() {
    FilterInstance in =
        filter("e.lang", Operator.IN, null).toBuilder().values(List.of("en", "", "fr")).build();
    assertEquals("e.lang IN (:i0celang_0, :i0celang_1)", build(in));
    assertEquals(
        Map.of("i0celang_0", "en", "i0celang_1", "fr"), params().getStringParams());
  }

  @Test
  void inWithoutValuesIsSkipped() {
    assertTrue(
        filterExpressionBuilder
            .build(List.of(filter("e.lang", Operator.IN, null)), DEFINITIONS, queryBuilder)
            .isEmpty());
  }

  @Test
  void exprOverridesCondition() {
    FilterInstance filter =
        filter("e.subject", Operator.CONTAINS, "%abc%").toBuilder().expr(Operator.LIKE).build();
    assertEquals("e.subject LIKE :i0cesubject", build(filter));
    assertEquals("%abc%", params().getStringParams().get("i0cesubject"));
  }

  @Test
  void missingDefinitionIsRejected() {
    MissingFilterDefinitionException exception =
        assertThrows(
            MissingFilterDefinitionException.class,
            () ->
                filterExpressionBuilder.build(
                    List.of(filter("e.unknown", Operator.EQ, "a")), DEFINITIONS, queryBuilder));
    assertEquals("e.unknown", exception.getColumn());
  }

  @Test
  void applyAndsExpressionIntoWhere() {
    queryBuilder.andWhere("e.is_deleted = 0");
    assertTrue(
        filterExpressionBuilder.apply(
            List.of(filter("e.subject", Operator.EQ, "a")), DEFINITIONS, queryBuilder));
    assertEquals(
        "SELECT e.id FROM emails e WHERE (e.is_deleted = 0) AND (e.subject = :i0cesubject)",
        queryBuilder.getSql());
  }

  @Test
  void applyLeavesWhereUntouchedWhenEverythingIsSkipped() {
    assertFalse(
        filterExpressionBuilder.apply(
            List.of(filter("e.subject", Operator.EQ, "")), DEFINITIONS, queryBuilder));
    assertNull(queryBuilder.getWhere());
  }

  private String build(FilterInstance... filters) {
    Optional<CompositeExpression> expression =
        filterExpressionBuilder.build(List.of(filters), DEFINITIONS, queryBuilder);
    assertTrue(expression.isPresent());
    return expression.get().toString();
  }

  private Params params() {
    return queryBuilder.getParams();
  }

  private static FilterInstance filter(String column, Operator condition, String value) {
    return FilterInstance.builder().column(column).condition(condition).value(value).build();
  }

  private static FilterDefinition definition(SemanticType type) {
    return FilterDefinition.builder().type(type).build();
  }
}
