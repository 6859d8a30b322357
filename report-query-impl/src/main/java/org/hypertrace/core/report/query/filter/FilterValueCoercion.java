package org.hypertrace.core.report.query.filter;

import com.google.common.primitives.Doubles;
import com.google.common.primitives.Longs;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient conversion of user entered filter text. Text that does not start with a number becomes
 * zero instead of failing the whole report.
 */
public class FilterValueCoercion {

  private static final Pattern LEADING_NUMBER =
      Pattern.compile("^[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");
  private static final Set<String> TRUE_VALUES = Set.of("true", "yes", "on");

  private FilterValueCoercion() {
    // empty private constructor
  }

  public static long toLong(String value) {
    if (value == null) {
      return 0L;
    }
    String trimmed = value.trim();
    Long parsed = Longs.tryParse(trimmed);
    if (parsed != null) {
      return parsed;
    }
    return (long) toDouble(trimmed);
  }

  public static double toDouble(String value) {
    if (value == null) {
      return 0d;
    }
    String trimmed = value.trim();
    Double parsed = Doubles.tryParse(trimmed);
    if (parsed != null && !parsed.isNaN() && !parsed.isInfinite()) {
      return parsed;
    }
    Matcher matcher = LEADING_NUMBER.matcher(trimmed);
    if (matcher.find()) {
      return Double.parseDouble(matcher.group());
    }
    return 0d;
  }

  public static boolean toBoolean(String value) {
    if (value == null) {
      return false;
    }
    String trimmed = value.trim().toLowerCase(Locale.ROOT);
    if (TRUE_VALUES.contains(trimmed)) {
      return true;
    }
    return toDouble(trimmed) != 0d;
  }
}
