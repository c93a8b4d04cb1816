package cafe.woden.projectexplorer.app.selection;

import cafe.woden.projectexplorer.app.tree.ResourceNode;

public enum SelectionState {
  NO_SELECTION,
  ROOT_SELECTED,
  PROJECT_SELECTED,
  ZONE_SELECTED,
  INSTANCE_SELECTED;

  public static SelectionState of(ResourceNode node) {
    if (node == null) return NO_SELECTION;
    return switch (node.kind()) {
      case ROOT -> ROOT_SELECTED;
      case PROJECT -> PROJECT_SELECTED;
      case ZONE -> ZONE_SELECTED;
      case INSTANCE -> INSTANCE_SELECTED;
    };
  }
}
