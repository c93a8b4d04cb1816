package cafe.woden.projectexplorer.inventory;

import cafe.woden.projectexplorer.app.api.InventoryPort;
import cafe.woden.projectexplorer.app.api.ResourceAccessDeniedException;
import cafe.woden.projectexplorer.config.ExplorerProperties;
import cafe.woden.projectexplorer.model.InstanceDescriptor;
import cafe.woden.projectexplorer.model.InstanceStatus;
import cafe.woden.projectexplorer.model.OperatingSystem;
import cafe.woden.projectexplorer.model.ProjectMetadata;
import io.reactivex.rxjava3.core.Single;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.jmolecules.architecture.layered.InfrastructureLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves the inventory declared under {@code explorer.offline.projects}.
 *
 * <p>Projects that are not declared, or declared with {@code accessible: false}, behave like
 * projects the caller may not read.
 */
@InfrastructureLayer
public class OfflineInventoryAdapter implements InventoryPort {
  private static final Logger log = LoggerFactory.getLogger(OfflineInventoryAdapter.class);

  private final Map<String, ExplorerProperties.Offline.Project> byId = new LinkedHashMap<>();

  public OfflineInventoryAdapter(ExplorerProperties props) {
    Objects.requireNonNull(props, "props");
    for (ExplorerProperties.Offline.Project p : props.offline().projects()) {
      if (p == null || p.id().isEmpty()) continue;
      byId.put(p.id(), p);
    }
    log.info("[inventory] offline inventory with {} project(s)", byId.size());
  }

  @Override
  public Single<ProjectMetadata> getProject(String projectId) {
    return Single.fromCallable(
        () -> {
          ExplorerProperties.Offline.Project p = requireReadable(projectId);
          return new ProjectMetadata(p.id(), p.displayName());
        });
  }

  @Override
  public Single<List<InstanceDescriptor>> listInstances(String projectId) {
    return Single.fromCallable(
        () -> {
          ExplorerProperties.Offline.Project p = requireReadable(projectId);
          List<InstanceDescriptor> out = new ArrayList<>();
          for (ExplorerProperties.Offline.Instance i : p.instances()) {
            if (i == null) continue;
            out.add(toDescriptor(i));
          }
          return List.copyOf(out);
        });
  }

  private ExplorerProperties.Offline.Project requireReadable(String projectId) {
    String id = Objects.toString(projectId, "").trim();
    ExplorerProperties.Offline.Project p = byId.get(id);
    if (p == null || !p.accessible()) {
      log.debug("[inventory] [{}] access denied", id);
      throw new ResourceAccessDeniedException("Access to project '" + id + "' denied");
    }
    return p;
  }

  static InstanceDescriptor toDescriptor(ExplorerProperties.Offline.Instance i) {
    boolean windows = OperatingSystem.WINDOWS.name().equals(i.os().trim().toUpperCase(Locale.ROOT));
    List<String> features =
        windows ? List.of(OperatingSystem.WINDOWS_GUEST_OS_FEATURE) : List.of();
    return new InstanceDescriptor(
        i.id(), i.zone(), i.name(), features, InstanceStatus.parse(i.status()));
  }
}
