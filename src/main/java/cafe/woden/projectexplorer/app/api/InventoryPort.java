package cafe.woden.projectexplorer.app.api;

import cafe.woden.projectexplorer.model.InstanceDescriptor;
import cafe.woden.projectexplorer.model.ProjectMetadata;
import io.reactivex.rxjava3.core.Single;
import java.util.List;

/**
 * Read-only access to the remote compute inventory.
 *
 * <p>Calls are cold: nothing is sent until the returned {@link Single} is subscribed, and disposing
 * the subscription cancels the call.
 */
public interface InventoryPort {

  /**
   * Resolves display metadata for a project.
   *
   * <p>Fails with {@link ResourceAccessDeniedException} when the caller may not see the project,
   * and with {@link ResourceFetchException} for any other backend failure.
   */
  Single<ProjectMetadata> getProject(String projectId);

  /** Lists every instance of a project across all zones. */
  Single<List<InstanceDescriptor>> listInstances(String projectId);
}
