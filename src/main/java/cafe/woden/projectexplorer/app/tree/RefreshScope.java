package cafe.woden.projectexplorer.app.tree;

import java.util.Objects;

/**
 * Which part of the tree a refresh reloads.
 *
 * <p>{@code project == null} means every tracked project is listed again.
 */
public record RefreshScope(ProjectNode project) {

  private static final RefreshScope ALL_PROJECTS = new RefreshScope(null);

  public static RefreshScope allProjects() {
    return ALL_PROJECTS;
  }

  public static RefreshScope zonesOf(ProjectNode project) {
    return new RefreshScope(Objects.requireNonNull(project, "project"));
  }

  public boolean reloadsProjects() {
    return project == null;
  }
}
