package cafe.woden.projectexplorer.app.tree;

/**
 * Notification that a child collection must be treated as replaced.
 *
 * <p>A replace is published as a {@link Phase#CLEARED} reset followed by a {@link Phase#REPLACED}
 * reset; there are no incremental add/remove notifications.
 */
public record ChildrenReset(ResourceNode owner, Phase phase, int size) {

  public enum Phase {
    CLEARED,
    REPLACED
  }
}
