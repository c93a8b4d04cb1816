package cafe.woden.projectexplorer.model;

import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

@ValueObject
public record ZoneLocator(String projectId, String name) implements ResourceLocator {

  public ZoneLocator {
    projectId = Objects.toString(projectId, "").trim();
    name = Objects.toString(name, "").trim();
    if (projectId.isEmpty()) throw new IllegalArgumentException("projectId must not be blank");
    if (name.isEmpty()) throw new IllegalArgumentException("zone must not be blank");
  }

  public ProjectLocator project() {
    return new ProjectLocator(projectId);
  }

  @Override
  public String path() {
    return "projects/" + projectId + "/zones/" + name;
  }

  @Override
  public String toString() {
    return path();
  }
}
