package cafe.woden.projectexplorer.app.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives the visible children of a node from its raw children.
 *
 * <p>Only instances are filtered. Projects and zones always stay visible, even when none of their
 * instances match.
 */
public final class NodeFilter {

  private NodeFilter() {}

  public static List<ResourceNode> apply(List<ResourceNode> rawChildren, FilterState filter) {
    if (rawChildren == null || rawChildren.isEmpty()) return List.of();
    FilterState f = filter == null ? FilterState.all() : filter;

    ArrayList<ResourceNode> out = new ArrayList<>(rawChildren.size());
    for (ResourceNode node : rawChildren) {
      if (node instanceof InstanceNode instance) {
        if (!f.includes(instance.operatingSystem())) continue;
        if (!f.matchesName(instance.displayText())) continue;
      }
      out.add(node);
    }
    return List.copyOf(out);
  }
}
