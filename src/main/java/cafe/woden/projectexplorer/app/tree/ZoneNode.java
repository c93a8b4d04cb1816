package cafe.woden.projectexplorer.app.tree;

import cafe.woden.projectexplorer.model.ZoneLocator;
import java.util.Objects;

/** A zone that holds at least one instance of its project. */
public final class ZoneNode extends ResourceNode {

  private final ZoneLocator locator;

  ZoneNode(ProjectNode parent, ZoneLocator locator) {
    super(Objects.requireNonNull(parent, "parent"));
    this.locator = Objects.requireNonNull(locator, "locator");
  }

  @Override
  public NodeKind kind() {
    return NodeKind.ZONE;
  }

  @Override
  public ZoneLocator locator() {
    return locator;
  }

  @Override
  public ProjectNode parent() {
    return (ProjectNode) super.parent();
  }

  @Override
  public String displayText() {
    return locator.name();
  }

  @Override
  public NodeImage imageVariant() {
    return NodeImage.ZONE;
  }
}
