package cafe.woden.projectexplorer.model;

import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Identifies a project by its id.
 *
 * <p>Project ids are case-sensitive; surrounding whitespace is dropped.
 */
@ValueObject
public record ProjectLocator(String projectId) implements ResourceLocator {

  public ProjectLocator {
    projectId = Objects.toString(projectId, "").trim();
    if (projectId.isEmpty()) throw new IllegalArgumentException("projectId must not be blank");
  }

  @Override
  public String name() {
    return projectId;
  }

  @Override
  public String path() {
    return "projects/" + projectId;
  }

  @Override
  public String toString() {
    return projectId;
  }
}
