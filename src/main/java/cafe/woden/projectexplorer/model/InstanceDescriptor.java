package cafe.woden.projectexplorer.model;

import java.util.List;
import java.util.Objects;

/**
 * One row of an instance listing.
 *
 * <p>{@code zone} may be given either as a bare zone name or as a full zone URL; only the last path
 * segment is kept.
 */
public record InstanceDescriptor(
    long id, String zone, String name, List<String> guestOsFeatures, InstanceStatus status) {

  public InstanceDescriptor {
    zone = lastSegment(zone);
    name = Objects.toString(name, "").trim();
    guestOsFeatures = guestOsFeatures == null ? List.of() : List.copyOf(guestOsFeatures);
    if (status == null) status = InstanceStatus.OTHER;
  }

  public OperatingSystem operatingSystem() {
    return OperatingSystem.fromGuestOsFeatures(guestOsFeatures);
  }

  public InstanceLocator locator(String projectId) {
    return new InstanceLocator(projectId, zone, name);
  }

  static String lastSegment(String value) {
    String v = Objects.toString(value, "").trim();
    int slash = v.lastIndexOf('/');
    return slash >= 0 ? v.substring(slash + 1) : v;
  }
}
