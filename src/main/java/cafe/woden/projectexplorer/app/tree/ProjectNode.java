package cafe.woden.projectexplorer.app.tree;

import cafe.woden.projectexplorer.model.ProjectLocator;
import java.util.Objects;

/**
 * A tracked project.
 *
 * <p>Projects whose metadata could not be read are still listed, under a synthesized name, but
 * never have children.
 */
public final class ProjectNode extends ResourceNode {

  private final ProjectLocator locator;
  private final String displayName;
  private final boolean accessible;

  ProjectNode(RootNode parent, ProjectLocator locator, String displayName, boolean accessible) {
    super(Objects.requireNonNull(parent, "parent"));
    this.locator = Objects.requireNonNull(locator, "locator");
    this.displayName = Objects.toString(displayName, "").trim();
    this.accessible = accessible;
  }

  static ProjectNode accessible(RootNode parent, ProjectLocator locator, String displayName) {
    return new ProjectNode(parent, locator, displayName, true);
  }

  static ProjectNode inaccessible(RootNode parent, ProjectLocator locator) {
    return new ProjectNode(parent, locator, null, false);
  }

  @Override
  public NodeKind kind() {
    return NodeKind.PROJECT;
  }

  @Override
  public ProjectLocator locator() {
    return locator;
  }

  public String projectId() {
    return locator.projectId();
  }

  public boolean isAccessible() {
    return accessible;
  }

  @Override
  public RootNode parent() {
    return (RootNode) super.parent();
  }

  @Override
  public String displayText() {
    String id = locator.projectId();
    if (!accessible) return "inaccessible project (" + id + ")";
    if (displayName.isEmpty() || displayName.equals(id)) return id;
    return displayName + " (" + id + ")";
  }

  @Override
  public NodeImage imageVariant() {
    return accessible ? NodeImage.PROJECT : NodeImage.PROJECT_INACCESSIBLE;
  }
}
