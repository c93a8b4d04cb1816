package cafe.woden.projectexplorer.app.tree;

import cafe.woden.projectexplorer.app.api.TrackedProjectsPort;
import cafe.woden.projectexplorer.app.api.UnknownResourceException;
import cafe.woden.projectexplorer.app.session.ConnectionStateTracker;
import cafe.woden.projectexplorer.model.InstanceLocator;
import cafe.woden.projectexplorer.model.ProjectLocator;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Single;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Owns the root of the resource hierarchy and every write to a node's children.
 *
 * <p>Children are fetched on demand and cached per node. Each node has at most one fetch in
 * flight; callers arriving while it runs share its result. A fetch that fails or is cancelled
 * leaves the previously cached children in place.
 *
 * <p>Nothing here chooses a thread: fetches run wherever the caller subscribes.
 */
@Component
@ApplicationLayer
public class ResourceTree {
  private static final Logger log = LoggerFactory.getLogger(ResourceTree.class);

  private final RootNode root = new RootNode();
  private final ResourceNodeLoader loader;
  private final TrackedProjectsPort trackedProjects;
  private final ConnectionStateTracker connectionState;
  private volatile FilterState filter = FilterState.all();

  public ResourceTree(
      ResourceNodeLoader loader,
      TrackedProjectsPort trackedProjects,
      ConnectionStateTracker connectionState) {
    this.loader = Objects.requireNonNull(loader, "loader");
    this.trackedProjects = Objects.requireNonNull(trackedProjects, "trackedProjects");
    this.connectionState = Objects.requireNonNull(connectionState, "connectionState");
  }

  public RootNode root() {
    return root;
  }

  public FilterState filter() {
    return filter;
  }

  /**
   * Returns the filtered children of {@code node}.
   *
   * <p>Succeeds immediately when the children are cached and {@code forceReload} is false.
   * Otherwise joins the node's in-flight fetch or starts a new one. The fetch runs while at least
   * one caller is subscribed; when the last one disposes, the backend call is disposed too.
   */
  public Single<NodeChildren> getFilteredChildren(ResourceNode node, boolean forceReload) {
    requireOwned(node);
    synchronized (node) {
      if (!forceReload && node.isLoaded()) return Single.just(node.children());

      PendingFetch inFlight = node.pendingFetch();
      if (inFlight != null) return inFlight.result;

      PendingFetch fetch = new PendingFetch();
      Single<NodeChildren> shared =
          loader
              .load(node)
              .takeUntil(fetch.cancellation)
              .map(children -> commit(node, fetch, children))
              .doOnError(err -> onFetchFailed(node, fetch, err))
              .doOnDispose(() -> onFetchAbandoned(node, fetch))
              .toObservable()
              .replay(1)
              .refCount()
              .singleOrError();
      // refCount reconnects once its source terminates; late subscribers get the kept outcome.
      fetch.result =
          Single.defer(
              () -> {
                Single<NodeChildren> settled = fetch.settled();
                if (settled != null) return settled;
                if (fetch.isAbandoned()) return getFilteredChildren(node, false);
                return shared;
              });
      node.beginFetch(fetch);
      return fetch.result;
    }
  }

  /**
   * Cancels the node's in-flight fetch, if any.
   *
   * <p>Every caller awaiting it receives a {@link CancellationException}.
   */
  public boolean cancelPendingFetch(ResourceNode node) {
    requireOwned(node);
    PendingFetch fetch = node.pendingFetch();
    if (fetch == null) return false;
    node.endFetch(fetch);
    fetch.cancel();
    return true;
  }

  /** Marks the node's children stale; the next request fetches them again. */
  public void invalidate(ResourceNode node) {
    requireOwned(node);
    node.invalidate();
  }

  public Completable addTrackedProject(ProjectLocator project) {
    Objects.requireNonNull(project, "project");
    return Completable.defer(
        () -> {
          trackedProjects.add(project);
          log.info("[{}] project added", project);
          invalidate(root);
          return getFilteredChildren(root, false).ignoreElement();
        });
  }

  public Completable removeTrackedProject(ProjectLocator project) {
    Objects.requireNonNull(project, "project");
    return Completable.defer(
        () -> {
          if (!trackedProjects.remove(project)) {
            log.debug("[{}] remove ignored, project is not tracked", project);
            return Completable.complete();
          }
          log.info("[{}] project removed", project);
          invalidate(root);
          return getFilteredChildren(root, false).ignoreElement();
        });
  }

  /**
   * Reloads either the project list or, for every project whose zones are loaded, its zones.
   *
   * <p>Listing projects re-validates access to each of them, so zone-level refresh is the cheap
   * default. Instances are fetched again lazily when their zone is next expanded.
   */
  public Completable refresh(boolean reloadProjects) {
    if (reloadProjects) return refresh(RefreshScope.allProjects());

    return Completable.defer(
        () -> {
          if (!root.isLoaded()) return Completable.complete();
          List<Completable> reloads = new ArrayList<>();
          for (ResourceNode child : root.rawChildren()) {
            if (child instanceof ProjectNode project && project.isLoaded()) {
              reloads.add(getFilteredChildren(project, true).ignoreElement());
            }
          }
          return Completable.merge(reloads);
        });
  }

  public Completable refresh(RefreshScope scope) {
    Objects.requireNonNull(scope, "scope");
    if (scope.reloadsProjects()) {
      return Completable.defer(() -> getFilteredChildren(root, true).ignoreElement());
    }
    return Completable.defer(() -> getFilteredChildren(scope.project(), true).ignoreElement());
  }

  /** Switches the filter and re-derives every loaded zone's children. Never fetches. */
  public void applyFilter(FilterState next) {
    FilterState f = next == null ? FilterState.all() : next;
    this.filter = f;

    List<ZoneNode> zones = new ArrayList<>();
    collectLoadedZones(root, zones);
    for (ZoneNode zone : zones) {
      zone.children().replaceAll(NodeFilter.apply(zone.rawChildren(), f));
    }
    log.debug("filter applied to {} zone(s): {}", zones.size(), f);
  }

  /** Finds the loaded project node for {@code project}, if the root listing contains it. */
  public ProjectNode findProject(ProjectLocator project) {
    if (project == null) return null;
    for (ResourceNode child : root.rawChildren()) {
      if (child instanceof ProjectNode p && p.locator().equals(project)) return p;
    }
    return null;
  }

  private NodeChildren commit(ResourceNode node, PendingFetch fetch, List<ResourceNode> loaded) {
    List<ResourceNode> previous = node.commit(fetch, loaded);
    if (isAttached(node)) {
      syncConnectionTracking(previous, loaded);
    } else {
      log.debug("[{}] node left the tree while loading; instances not tracked", describe(node));
    }
    node.children().replaceAll(NodeFilter.apply(loaded, filter));
    log.debug("[{}] children loaded ({})", describe(node), loaded.size());
    fetch.succeeded(node.children());
    return node.children();
  }

  private void onFetchFailed(ResourceNode node, PendingFetch fetch, Throwable err) {
    fetch.failed(err);
    node.endFetch(fetch);
    if (err instanceof CancellationException) {
      log.debug("[{}] fetch cancelled; keeping cached children", describe(node));
    } else {
      log.warn("[{}] fetch failed; keeping cached children", describe(node), err);
    }
  }

  private void onFetchAbandoned(ResourceNode node, PendingFetch fetch) {
    fetch.abandon();
    node.endFetch(fetch);
    log.debug("[{}] fetch abandoned by every caller", describe(node));
  }

  /** Unregisters instances that left the tree and registers those that joined it. */
  private void syncConnectionTracking(List<ResourceNode> previous, List<ResourceNode> loaded) {
    Set<InstanceLocator> before = new HashSet<>();
    collectInstances(previous, before);
    Set<InstanceLocator> after = new HashSet<>();
    for (ResourceNode node : loaded) {
      if (node instanceof InstanceNode instance) after.add(instance.locator());
    }

    Set<InstanceLocator> removed = new HashSet<>(before);
    removed.removeAll(after);
    Set<InstanceLocator> added = new HashSet<>(after);
    added.removeAll(before);

    connectionState.unregister(removed);
    connectionState.register(added);
  }

  private static void collectInstances(List<ResourceNode> nodes, Set<InstanceLocator> out) {
    for (ResourceNode node : nodes) {
      if (node instanceof InstanceNode instance) {
        out.add(instance.locator());
      } else {
        collectInstances(node.rawChildren(), out);
      }
    }
  }

  private static void collectLoadedZones(ResourceNode node, List<ZoneNode> out) {
    for (ResourceNode child : node.rawChildren()) {
      if (child instanceof ZoneNode zone) {
        if (zone.isLoaded()) out.add(zone);
      } else if (!(child instanceof InstanceNode)) {
        collectLoadedZones(child, out);
      }
    }
  }

  /** Rejects nodes of another tree and nodes dropped by a reload of one of their ancestors. */
  private void requireOwned(ResourceNode node) {
    Objects.requireNonNull(node, "node");
    if (!isAttached(node)) {
      throw new UnknownResourceException("Node is not part of this tree: " + node.displayText());
    }
  }

  /** True when every link from {@code node} up to this tree's root is still in a raw listing. */
  private boolean isAttached(ResourceNode node) {
    ResourceNode current = node;
    while (current.parent() != null) {
      ResourceNode parent = current.parent();
      if (!containsSame(parent.rawChildren(), current)) return false;
      current = parent;
    }
    return current == root;
  }

  private static boolean containsSame(List<ResourceNode> nodes, ResourceNode node) {
    for (ResourceNode candidate : nodes) {
      if (candidate == node) return true;
    }
    return false;
  }

  private static String describe(ResourceNode node) {
    return node.locator() == null ? "root" : node.locator().toString();
  }
}
