package cafe.woden.projectexplorer.app.tree;

import cafe.woden.projectexplorer.model.OperatingSystem;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * What the tree currently shows of its instances.
 *
 * <p>{@code instanceNamePattern} is a case-insensitive substring; {@code null} or blank matches
 * every name.
 */
public record FilterState(Set<OperatingSystem> operatingSystems, String instanceNamePattern) {

  public FilterState {
    operatingSystems =
        operatingSystems == null || operatingSystems.isEmpty()
            ? Set.of()
            : Set.copyOf(EnumSet.copyOf(operatingSystems));
    String pattern = Objects.toString(instanceNamePattern, "").trim();
    instanceNamePattern = pattern.isEmpty() ? null : pattern;
  }

  public static FilterState all() {
    return new FilterState(EnumSet.allOf(OperatingSystem.class), null);
  }

  public FilterState withOperatingSystems(Set<OperatingSystem> next) {
    return new FilterState(next, instanceNamePattern);
  }

  public FilterState withInstanceNamePattern(String next) {
    return new FilterState(operatingSystems, next);
  }

  public boolean includes(OperatingSystem os) {
    return os != null && operatingSystems.contains(os);
  }

  public boolean matchesName(String name) {
    if (instanceNamePattern == null) return true;
    String n = Objects.toString(name, "").toLowerCase(Locale.ROOT);
    return n.contains(instanceNamePattern.toLowerCase(Locale.ROOT));
  }
}
