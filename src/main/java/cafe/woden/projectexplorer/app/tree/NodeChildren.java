package cafe.woden.projectexplorer.app.tree;

import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.processors.FlowableProcessor;
import io.reactivex.rxjava3.processors.PublishProcessor;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Live, read-only view of a node's filtered children.
 *
 * <p>The same instance is handed out for the lifetime of its owner; reloads and filter changes
 * replace its contents in place and publish {@link ChildrenReset} notifications.
 */
public final class NodeChildren implements Iterable<ResourceNode> {

  private final ResourceNode owner;
  private final FlowableProcessor<ChildrenReset> resets =
      PublishProcessor.<ChildrenReset>create().toSerialized();
  private volatile List<ResourceNode> items = List.of();

  NodeChildren(ResourceNode owner) {
    this.owner = owner;
  }

  public int size() {
    return items.size();
  }

  public boolean isEmpty() {
    return items.isEmpty();
  }

  public ResourceNode get(int index) {
    return items.get(index);
  }

  /** Immutable copy of the current contents. */
  public List<ResourceNode> snapshot() {
    return items;
  }

  public Stream<ResourceNode> stream() {
    return items.stream();
  }

  @Override
  public Iterator<ResourceNode> iterator() {
    return items.iterator();
  }

  public Flowable<ChildrenReset> resets() {
    return resets.onBackpressureBuffer();
  }

  void replaceAll(List<ResourceNode> next) {
    items = List.of();
    resets.onNext(new ChildrenReset(owner, ChildrenReset.Phase.CLEARED, 0));
    items = next == null ? List.of() : List.copyOf(next);
    resets.onNext(new ChildrenReset(owner, ChildrenReset.Phase.REPLACED, items.size()));
  }

  @Override
  public String toString() {
    return items.toString();
  }
}
