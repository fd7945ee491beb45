package sh.xana.hashdive.extract;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.jetbrains.annotations.Nullable;

/** Number formats used by the rendered page: thousands commas, unicode minus, k/m suffixes */
public class MarkupPatterns {
  private static final char UNICODE_MINUS = '−';

  private MarkupPatterns() {}

  @Nullable
  public static Matcher find(Pattern pattern, String input) {
    Matcher matcher = pattern.matcher(input);
    return matcher.find() ? matcher : null;
  }

  @Nullable
  public static String firstGroup(Pattern pattern, String input) {
    Matcher matcher = find(pattern, input);
    return matcher == null ? null : matcher.group(1);
  }

  /** "1,234.5" to 1234.5 */
  @Nullable
  public static Double parseDecimal(@Nullable String value) {
    if (StringUtils.isBlank(value)) {
      return null;
    }
    String cleaned = StringUtils.remove(value.trim(), ',').replace(UNICODE_MINUS, '-');
    cleaned = StringUtils.removeStart(cleaned, "+");
    if (!NumberUtils.isCreatable(cleaned)) {
      return null;
    }
    return NumberUtils.createDouble(cleaned);
  }

  /** Apply a captured "+", "-" or unicode minus sign group */
  @Nullable
  public static Double signed(@Nullable String sign, @Nullable Double value) {
    if (value == null) {
      return null;
    }
    if (sign != null && (sign.equals("-") || sign.equals(String.valueOf(UNICODE_MINUS)))) {
      return -value;
    }
    return value;
  }

  /** "12.5k" to 12500, "3m" to 3000000 */
  @Nullable
  public static Double parseAbbreviated(@Nullable String value) {
    if (StringUtils.isBlank(value)) {
      return null;
    }
    String trimmed = value.trim();
    char suffix = Character.toLowerCase(trimmed.charAt(trimmed.length() - 1));
    double multiplier = 1;
    if (suffix == 'k') {
      multiplier = 1_000;
    } else if (suffix == 'm') {
      multiplier = 1_000_000;
    }
    if (multiplier != 1) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    Double number = parseDecimal(trimmed);
    return number == null ? null : number * multiplier;
  }

  /** @return null when not a plain count or too large for an int */
  @Nullable
  public static Integer parseInteger(@Nullable String value) {
    if (StringUtils.isBlank(value)) {
      return null;
    }
    String cleaned = StringUtils.stripStart(StringUtils.remove(value.trim(), ','), "0");
    if (cleaned.isEmpty()) {
      return 0;
    }
    if (!NumberUtils.isDigits(cleaned) || cleaned.length() > 10) {
      return null;
    }
    long parsed = Long.parseLong(cleaned);
    return parsed > Integer.MAX_VALUE ? null : (int) parsed;
  }

  public static double round2(double value) {
    return Math.round(value * 100) / 100.0;
  }
}
