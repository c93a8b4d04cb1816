package cafe.woden.projectexplorer.app.tree;

/** Icon variant a renderer should use for a node. */
public enum NodeImage {
  ROOT,
  PROJECT,
  PROJECT_INACCESSIBLE,
  ZONE,
  WINDOWS_CONNECTED,
  WINDOWS_DISCONNECTED,
  WINDOWS_STOPPED,
  LINUX_CONNECTED,
  LINUX_DISCONNECTED,
  LINUX_STOPPED
}
