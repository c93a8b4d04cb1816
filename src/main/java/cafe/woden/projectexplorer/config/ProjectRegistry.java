package cafe.woden.projectexplorer.config;

import cafe.woden.projectexplorer.app.api.TrackedProjectsPort;
import cafe.woden.projectexplorer.app.api.UnknownResourceException;
import cafe.woden.projectexplorer.model.ProjectLocator;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.processors.BehaviorProcessor;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.jmolecules.architecture.layered.InfrastructureLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Live, mutable set of tracked projects.
 *
 * <p>Seeded from the runtime config; every mutation is written back and published to
 * {@link #updates()}.
 */
@Component
@InfrastructureLayer
public class ProjectRegistry implements TrackedProjectsPort {
  private static final Logger log = LoggerFactory.getLogger(ProjectRegistry.class);

  private final RuntimeConfigStore runtimeConfig;
  private final LinkedHashMap<String, ProjectLocator> byId = new LinkedHashMap<>();
  private final BehaviorProcessor<List<ProjectLocator>> updates = BehaviorProcessor.create();

  public ProjectRegistry(RuntimeConfigStore runtimeConfig) {
    this.runtimeConfig = Objects.requireNonNull(runtimeConfig, "runtimeConfig");

    for (String id : runtimeConfig.readTrackedProjects()) {
      String trimmed = Objects.toString(id, "").trim();
      if (trimmed.isEmpty()) continue;
      byId.put(trimmed, new ProjectLocator(trimmed));
    }
    log.debug("[explorer] {} tracked project(s) loaded", byId.size());
    updates.onNext(snapshot());
  }

  @Override
  public synchronized List<ProjectLocator> projects() {
    return snapshot();
  }

  public synchronized Optional<ProjectLocator> find(String projectId) {
    String id = Objects.toString(projectId, "").trim();
    if (id.isEmpty()) return Optional.empty();
    return Optional.ofNullable(byId.get(id));
  }

  public synchronized ProjectLocator require(String projectId) {
    return find(projectId)
        .orElseThrow(() -> new UnknownResourceException("Unknown project id: " + projectId));
  }

  public synchronized boolean contains(ProjectLocator project) {
    return project != null && byId.containsKey(project.projectId());
  }

  public Flowable<List<ProjectLocator>> updates() {
    return updates.onBackpressureLatest();
  }

  @Override
  public synchronized void add(ProjectLocator project) {
    Objects.requireNonNull(project, "project");
    if (byId.putIfAbsent(project.projectId(), project) != null) return;
    persistAndEmit();
  }

  @Override
  public synchronized boolean remove(ProjectLocator project) {
    if (project == null || byId.remove(project.projectId()) == null) return false;
    persistAndEmit();
    return true;
  }

  private void persistAndEmit() {
    List<ProjectLocator> snap = snapshot();
    runtimeConfig.writeTrackedProjects(snap.stream().map(ProjectLocator::projectId).toList());
    updates.onNext(snap);
  }

  private List<ProjectLocator> snapshot() {
    return List.copyOf(byId.values());
  }
}
