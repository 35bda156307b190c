package io.statefleet.fleet.fleethealth;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/** Formatting of dates and distances inside issue messages. */
final class IssueFormat {

  private static final DateTimeFormatter SHORT_DATE =
      DateTimeFormatter.ofPattern("d MMM", Locale.ENGLISH);

  private IssueFormat() {}

  /** "5 Mar". */
  static String shortDate(Instant instant, ZoneId zone) {
    return SHORT_DATE.format(instant.atZone(zone));
  }

  /** "85,000". */
  static String km(long km) {
    return String.format(Locale.ENGLISH, "%,d", km);
  }

  static String plural(int count, String noun) {
    return count + " " + noun + (count == 1 ? "" : "s");
  }
}
