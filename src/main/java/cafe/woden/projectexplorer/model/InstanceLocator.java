package cafe.woden.projectexplorer.model;

import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Identifies a VM instance by project, zone and name.
 *
 * <p>This is the key used by session events and by the connection-state tracker.
 */
@ValueObject
public record InstanceLocator(String projectId, String zone, String name)
    implements ResourceLocator {

  public InstanceLocator {
    projectId = Objects.toString(projectId, "").trim();
    zone = Objects.toString(zone, "").trim();
    name = Objects.toString(name, "").trim();
    if (projectId.isEmpty()) throw new IllegalArgumentException("projectId must not be blank");
    if (zone.isEmpty()) throw new IllegalArgumentException("zone must not be blank");
    if (name.isEmpty()) throw new IllegalArgumentException("name must not be blank");
  }

  public ZoneLocator zoneLocator() {
    return new ZoneLocator(projectId, zone);
  }

  @Override
  public String path() {
    return "projects/" + projectId + "/zones/" + zone + "/instances/" + name;
  }

  @Override
  public String toString() {
    return path();
  }
}
