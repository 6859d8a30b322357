package org.hypertrace.core.report.query.sql;

import java.util.regex.Pattern;

/** Helpers for identifiers that end up verbatim in the SQL text. */
public class SqlIdentifiers {

  private static final Pattern PLAIN_REFERENCE =
      Pattern.compile("^`?[A-Za-z0-9_]+`?(\\.`?[A-Za-z0-9_]+`?)?$");
  private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^A-Za-z0-9]");

  private SqlIdentifiers() {
    // empty private constructor
  }

  /**
   * Quotes a {@code table_alias.column_name} reference. Table aliases may be auto generated and
   * aliases like {@code 8e296a06} would otherwise be read as a number.
   */
  public static String sanitizeColumnName(String fullColumnName) {
    if (fullColumnName.indexOf('`') >= 0) {
      return fullColumnName;
    }
    int separator = fullColumnName.indexOf('.');
    if (separator < 0) {
      return "`" + fullColumnName + "`";
    }
    return "`"
        + fullColumnName.substring(0, separator)
        + "`.`"
        + fullColumnName.substring(separator + 1)
        + "`";
  }

  /** Whether the text is a bare column or {@code table.column} reference and nothing else. */
  public static boolean isPlainReference(String reference) {
    return reference != null && PLAIN_REFERENCE.matcher(reference).matches();
  }

  public static String requirePlainReference(String reference) {
    if (!isPlainReference(reference)) {
      throw new IllegalArgumentException(
          String.format("Not a registered column or plain column reference: {%s}", reference));
    }
    return reference;
  }

  /** Strips everything but ASCII letters and digits, for use in parameter names. */
  public static String alphanumeric(String value) {
    return NON_ALPHANUMERIC.matcher(value).replaceAll("");
  }
}
