package cafe.woden.projectexplorer.app.tree;

public enum NodeKind {
  ROOT,
  PROJECT,
  ZONE,
  INSTANCE
}
