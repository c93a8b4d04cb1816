package cafe.woden.projectexplorer.model;

import java.util.Locale;
import java.util.Objects;

/** Lifecycle status as reported by the inventory; unknown values map to {@link #OTHER}. */
public enum InstanceStatus {
  RUNNING,
  STOPPED,
  OTHER;

  public static InstanceStatus parse(String raw) {
    String s = Objects.toString(raw, "").trim().toUpperCase(Locale.ROOT);
    return switch (s) {
      case "RUNNING" -> RUNNING;
      case "STOPPED", "TERMINATED", "SUSPENDED" -> STOPPED;
      default -> OTHER;
    };
  }
}
