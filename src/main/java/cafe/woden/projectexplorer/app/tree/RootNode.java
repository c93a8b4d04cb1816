package cafe.woden.projectexplorer.app.tree;

import cafe.woden.projectexplorer.model.ResourceLocator;

public final class RootNode extends ResourceNode {

  public static final String DISPLAY_TEXT = "Google Cloud";

  RootNode() {
    super(null);
  }

  @Override
  public NodeKind kind() {
    return NodeKind.ROOT;
  }

  @Override
  public ResourceLocator locator() {
    return null;
  }

  @Override
  public String displayText() {
    return DISPLAY_TEXT;
  }

  @Override
  public NodeImage imageVariant() {
    return NodeImage.ROOT;
  }
}
