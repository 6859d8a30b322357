package org.hypertrace.core.report.query;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.annotation.Nullable;
import lombok.Value;
import org.hypertrace.core.report.query.sql.Params;

/** A compiled report: the SELECT statement, its named params and the content template to use. */
@Value
public class ReportQuery {
  private static final Pattern NAMED_PARAM = Pattern.compile(":([A-Za-z0-9_]+)");

  String sql;
  Params params;
  @Nullable String contentTemplate;

  public Optional<String> getContentTemplate() {
    return Optional.ofNullable(contentTemplate);
  }

  /**
   * Inlines the params into the statement. Meant for logging and troubleshooting only, the
   * statement must be executed with {@link #getParams()} bound.
   */
  public String resolveStatement() {
    Matcher matcher = NAMED_PARAM.matcher(sql);
    StringBuilder sb = new StringBuilder();
    while (matcher.find()) {
      String name = matcher.group(1);
      String replacement = params.contains(name) ? toSqlValue(params.getValue(name)) : matcher.group();
      matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(sb);
    return sb.toString();
  }

  private String toSqlValue(Object value) {
    if (value instanceof String) {
      return "'" + ((String) value).replace("'", "''") + "'";
    }
    if (value instanceof Boolean) {
      return Boolean.TRUE.equals(value) ? "1" : "0";
    }
    return String.valueOf(value);
  }
}
