package cafe.woden.projectexplorer.app.tree;

import cafe.woden.projectexplorer.app.api.InventoryPort;
import cafe.woden.projectexplorer.app.api.ResourceAccessDeniedException;
import cafe.woden.projectexplorer.app.api.TrackedProjectsPort;
import cafe.woden.projectexplorer.app.session.ConnectionStateTracker;
import cafe.woden.projectexplorer.model.InstanceDescriptor;
import cafe.woden.projectexplorer.model.ProjectLocator;
import cafe.woden.projectexplorer.model.ZoneLocator;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Single;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns inventory calls into child nodes, one strategy per node kind.
 *
 * <p>Every returned {@link Single} is cold and cancellable. Zones are not fetched on their own:
 * they are the distinct zones found in the project's instance listing, so a zone without instances
 * never shows up.
 */
@Component
@ApplicationLayer
public class ResourceNodeLoader {
  private static final Logger log = LoggerFactory.getLogger(ResourceNodeLoader.class);

  static final Comparator<ResourceNode> BY_DISPLAY_TEXT =
      Comparator.comparing(ResourceNode::displayText);

  private final InventoryPort inventory;
  private final TrackedProjectsPort trackedProjects;
  private final ConnectionStateTracker connectionState;

  public ResourceNodeLoader(
      InventoryPort inventory,
      TrackedProjectsPort trackedProjects,
      ConnectionStateTracker connectionState) {
    this.inventory = Objects.requireNonNull(inventory, "inventory");
    this.trackedProjects = Objects.requireNonNull(trackedProjects, "trackedProjects");
    this.connectionState = Objects.requireNonNull(connectionState, "connectionState");
  }

  public Single<List<ResourceNode>> load(ResourceNode parent) {
    Objects.requireNonNull(parent, "parent");
    if (parent instanceof RootNode root) return loadProjects(root);
    if (parent instanceof ProjectNode project) return loadZones(project);
    if (parent instanceof ZoneNode zone) return loadInstances(zone);
    return Single.just(List.of());
  }

  private Single<List<ResourceNode>> loadProjects(RootNode root) {
    return Single.defer(
        () ->
            Flowable.fromIterable(trackedProjects.projects())
                .flatMapSingle(project -> resolveProject(root, project))
                .toList()
                .map(ResourceNodeLoader::sortedByDisplayText));
  }

  private Single<ResourceNode> resolveProject(RootNode root, ProjectLocator project) {
    return inventory
        .getProject(project.projectId())
        .<ResourceNode>map(meta -> ProjectNode.accessible(root, project, meta.displayName()))
        .onErrorResumeNext(
            err -> {
              if (err instanceof ResourceAccessDeniedException) {
                log.warn("[{}] project is inaccessible: {}", project, err.getMessage());
                return Single.just(ProjectNode.inaccessible(root, project));
              }
              return Single.error(err);
            });
  }

  private Single<List<ResourceNode>> loadZones(ProjectNode project) {
    if (!project.isAccessible()) return Single.just(List.of());

    return inventory
        .listInstances(project.projectId())
        .map(
            instances -> {
              TreeSet<String> zones = new TreeSet<>();
              for (InstanceDescriptor instance : instances) {
                if (instance == null || instance.zone().isEmpty()) continue;
                zones.add(instance.zone());
              }
              return zones.stream()
                  .<ResourceNode>map(
                      zone -> new ZoneNode(project, new ZoneLocator(project.projectId(), zone)))
                  .toList();
            });
  }

  private Single<List<ResourceNode>> loadInstances(ZoneNode zone) {
    ZoneLocator locator = zone.locator();
    return inventory
        .listInstances(locator.projectId())
        .map(
            instances ->
                sortedByDisplayText(
                    instances.stream()
                        .filter(Objects::nonNull)
                        .filter(i -> locator.name().equals(i.zone()))
                        .filter(i -> !i.name().isEmpty())
                        .<ResourceNode>map(
                            i ->
                                new InstanceNode(
                                    zone,
                                    i.locator(locator.projectId()),
                                    i.operatingSystem(),
                                    i.status(),
                                    connectionState))
                        .toList()));
  }

  private static List<ResourceNode> sortedByDisplayText(List<ResourceNode> nodes) {
    return nodes.stream().sorted(BY_DISPLAY_TEXT).toList();
  }
}
