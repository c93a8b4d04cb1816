package cafe.woden.projectexplorer.model;

import java.util.Objects;

/** Display metadata of a project as resolved by the inventory. */
public record ProjectMetadata(String projectId, String displayName) {

  public ProjectMetadata {
    projectId = Objects.toString(projectId, "").trim();
    displayName = Objects.toString(displayName, "").trim();
    if (displayName.isEmpty()) displayName = projectId;
  }
}
