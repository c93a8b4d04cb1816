package cafe.woden.projectexplorer.app.tree;

import cafe.woden.projectexplorer.model.ResourceLocator;
import java.util.List;

/**
 * A node of the resource hierarchy.
 *
 * <p>The hierarchy is closed: {@link RootNode} owns {@link ProjectNode}s, which own {@link
 * ZoneNode}s, which own {@link InstanceNode}s. Every node caches the unfiltered children of its
 * last successful fetch ("raw children"); only {@link ResourceTree} writes that cache.
 */
public abstract sealed class ResourceNode permits RootNode, ProjectNode, ZoneNode, InstanceNode {

  private final ResourceNode parent;
  private final NodeChildren children;

  // Guarded by this.
  private List<ResourceNode> rawChildren = List.of();
  private boolean loaded;
  private PendingFetch pendingFetch;

  ResourceNode(ResourceNode parent) {
    this.parent = parent;
    this.children = new NodeChildren(this);
  }

  public abstract NodeKind kind();

  /** Identity of the node; {@code null} for the root. */
  public abstract ResourceLocator locator();

  public abstract String displayText();

  public abstract NodeImage imageVariant();

  /** {@code null} for the root. */
  public ResourceNode parent() {
    return parent;
  }

  /** Filtered, ordered children as of the last fetch or filter change. */
  public NodeChildren children() {
    return children;
  }

  /** True once children were fetched and not invalidated since. */
  public synchronized boolean isLoaded() {
    return loaded;
  }

  synchronized List<ResourceNode> rawChildren() {
    return rawChildren;
  }

  synchronized PendingFetch pendingFetch() {
    return pendingFetch;
  }

  synchronized void beginFetch(PendingFetch fetch) {
    this.pendingFetch = fetch;
  }

  /** Clears the pending slot if it still holds {@code fetch}. */
  synchronized void endFetch(PendingFetch fetch) {
    if (this.pendingFetch == fetch) this.pendingFetch = null;
  }

  /** Replaces the raw children and returns the previous ones. */
  synchronized List<ResourceNode> commit(PendingFetch fetch, List<ResourceNode> next) {
    List<ResourceNode> previous = this.rawChildren;
    this.rawChildren = List.copyOf(next);
    this.loaded = true;
    endFetch(fetch);
    return previous;
  }

  /** Keeps the stale list around so the next commit can diff against it. */
  synchronized void invalidate() {
    this.loaded = false;
  }

  @Override
  public String toString() {
    return displayText();
  }
}
