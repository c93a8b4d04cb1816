package cafe.woden.projectexplorer.inventory;

import static org.junit.jupiter.api.Assertions.assertEquals;

import cafe.woden.projectexplorer.app.api.ResourceAccessDeniedException;
import cafe.woden.projectexplorer.config.ExplorerProperties;
import cafe.woden.projectexplorer.model.InstanceDescriptor;
import cafe.woden.projectexplorer.model.InstanceStatus;
import cafe.woden.projectexplorer.model.OperatingSystem;
import cafe.woden.projectexplorer.model.ProjectMetadata;
import java.util.List;
import org.junit.jupiter.api.Test;

class OfflineInventoryAdapterTest {

  private final OfflineInventoryAdapter adapter =
      new OfflineInventoryAdapter(
          new ExplorerProperties(
              List.of(),
              null,
              null,
              new ExplorerProperties.Offline(
                  List.of(
                      new ExplorerProperties.Offline.Project(
                          "project-1",
                          "[project-1]",
                          null,
                          List.of(
                              new ExplorerProperties.Offline.Instance(
                                  1L,
                                  "projects/project-1/zones/zone-1",
                                  "windows-1",
                                  "Windows",
                                  "RUNNING"),
                              new ExplorerProperties.Offline.Instance(
                                  2L, "zone-1", "linux-1", null, "TERMINATED"))),
                      new ExplorerProperties.Offline.Project(
                          "inaccessible-1", null, false, null))),
              null));

  @Test
  void resolvesDeclaredProjects() {
    adapter
        .getProject("project-1")
        .test()
        .assertValue(new ProjectMetadata("project-1", "[project-1]"));
  }

  @Test
  void listsInstancesWithOsAndStatus() {
    List<InstanceDescriptor> instances = adapter.listInstances("project-1").blockingGet();

    assertEquals(2, instances.size());
    assertEquals("zone-1", instances.get(0).zone());
    assertEquals(OperatingSystem.WINDOWS, instances.get(0).operatingSystem());
    assertEquals(OperatingSystem.LINUX, instances.get(1).operatingSystem());
    assertEquals(InstanceStatus.STOPPED, instances.get(1).status());
  }

  @Test
  void inaccessibleAndUnknownProjectsAreDenied() {
    adapter.getProject("inaccessible-1").test().assertError(ResourceAccessDeniedException.class);
    adapter
        .listInstances("inaccessible-1")
        .test()
        .assertError(ResourceAccessDeniedException.class);
    adapter.getProject("unknown").test().assertError(ResourceAccessDeniedException.class);
  }
}
