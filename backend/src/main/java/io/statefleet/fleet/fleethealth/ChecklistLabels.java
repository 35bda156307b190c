package io.statefleet.fleet.fleethealth;

import java.util.Locale;
import java.util.regex.Pattern;

/** String helpers shared by checklist label resolvers. */
public final class ChecklistLabels {

  private static final Pattern PARENTHETICAL = Pattern.compile(" \\(.*\\)");

  private ChecklistLabels() {}

  /** "Tyres (tread depth, condition)" becomes "Tyres". */
  public static String stripParenthetical(String label) {
    if (label == null) {
      return "";
    }
    return PARENTHETICAL.matcher(label).replaceFirst("");
  }

  /** "brake_lights" becomes "Brake Lights"; used for keys missing from the catalog. */
  public static String humanizeKey(String key) {
    if (key == null || key.isBlank()) {
      return "";
    }
    var words = key.trim().split("_+");
    var label = new StringBuilder();
    for (String word : words) {
      if (word.isEmpty()) {
        continue;
      }
      if (label.length() > 0) {
        label.append(' ');
      }
      label.append(word.substring(0, 1).toUpperCase(Locale.ROOT)).append(word.substring(1));
    }
    return label.toString();
  }
}
