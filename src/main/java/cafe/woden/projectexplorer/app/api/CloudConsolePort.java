package cafe.woden.projectexplorer.app.api;

import cafe.woden.projectexplorer.model.InstanceLocator;
import cafe.woden.projectexplorer.model.ProjectLocator;
import cafe.woden.projectexplorer.model.ZoneLocator;

/** Opens pages of the cloud console. Fire-and-forget. */
public interface CloudConsolePort {

  void openInstanceList(ProjectLocator project);

  void openInstanceList(ZoneLocator zone);

  void openInstanceDetails(InstanceLocator instance);

  void openIapConfiguration(String projectId);
}
