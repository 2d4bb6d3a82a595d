package com.example.accounttransfer.service;

import java.util.Locale;
import java.util.regex.Pattern;

/** Normalization rules for account keys and the slugs derived from them. */
public final class RecordKeys {

  private static final Pattern DISALLOWED = Pattern.compile("[^a-z0-9 _.@-]");
  private static final Pattern REPEATED_SPACES = Pattern.compile(" {2,}");
  private static final Pattern SLUG_SEPARATORS = Pattern.compile("[^a-z0-9]+");

  private RecordKeys() {}

  /** Lower-cases {@code raw} and drops characters a login may not contain; never null. */
  public static String normalize(String raw) {
    if (raw == null) {
      return "";
    }
    final String lowered = raw.strip().toLowerCase(Locale.ROOT);
    final String filtered = DISALLOWED.matcher(lowered).replaceAll("");
    return REPEATED_SPACES.matcher(filtered).replaceAll(" ").strip();
  }

  public static String slug(String value) {
    if (value == null) {
      return "";
    }
    final String lowered = value.strip().toLowerCase(Locale.ROOT);
    final String dashed = SLUG_SEPARATORS.matcher(lowered).replaceAll("-");
    int start = 0;
    int end = dashed.length();
    while (start < end && dashed.charAt(start) == '-') {
      start++;
    }
    while (end > start && dashed.charAt(end - 1) == '-') {
      end--;
    }
    return dashed.substring(start, end);
  }
}
