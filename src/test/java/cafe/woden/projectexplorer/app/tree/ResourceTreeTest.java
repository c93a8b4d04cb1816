package cafe.woden.projectexplorer.app.tree;

import static cafe.woden.projectexplorer.app.tree.InventoryFixture.linux;
import static cafe.woden.projectexplorer.app.tree.InventoryFixture.texts;
import static cafe.woden.projectexplorer.app.tree.InventoryFixture.windows;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import cafe.woden.projectexplorer.app.api.ResourceFetchException;
import cafe.woden.projectexplorer.app.api.UnknownResourceException;
import cafe.woden.projectexplorer.model.InstanceDescriptor;
import cafe.woden.projectexplorer.model.InstanceLocator;
import cafe.woden.projectexplorer.model.OperatingSystem;
import cafe.woden.projectexplorer.model.ProjectLocator;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.subjects.SingleSubject;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class ResourceTreeTest {

  @Test
  void projectsAreOrderedByDisplayTextIncludingInaccessibleOnes() {
    InventoryFixture f = InventoryFixture.standard();

    NodeChildren projects = f.expandRoot();

    assertEquals(
        List.of(
            "[project-1] (project-1)",
            "inaccessible project (inaccessible-1)",
            "project-2"),
        texts(projects));
    ProjectNode inaccessible = (ProjectNode) projects.get(1);
    assertFalse(inaccessible.isAccessible());
    assertEquals(NodeImage.PROJECT_INACCESSIBLE, inaccessible.imageVariant());
  }

  @Test
  void inaccessibleProjectExposesNoChildrenWithoutCallingBackend() {
    InventoryFixture f = InventoryFixture.standard();
    f.expandRoot();
    ProjectNode inaccessible = f.tree.findProject(new ProjectLocator("inaccessible-1"));

    NodeChildren zones = f.tree.getFilteredChildren(inaccessible, false).blockingGet();

    assertTrue(zones.isEmpty());
    verify(f.inventory, never()).listInstances("inaccessible-1");
  }

  @Test
  void zonesAreDerivedFromInstanceListingAndInstancesSortedByName() {
    InventoryFixture f = InventoryFixture.standard();

    ZoneNode zone = f.expandZone("project-1", "zone-1");

    assertEquals(List.of("zone-1"), texts(zone.parent().children()));
    assertEquals(List.of("linux-zone-1", "windows-1"), texts(zone.children()));
    InstanceNode linuxInstance = (InstanceNode) zone.children().get(0);
    assertEquals(OperatingSystem.LINUX, linuxInstance.operatingSystem());
    assertTrue(((InstanceNode) zone.children().get(1)).isWindows());
  }

  @Test
  void cachedChildrenAreReturnedWithoutReloading() {
    InventoryFixture f = InventoryFixture.standard();
    ProjectNode project = f.expandProject("project-1");

    NodeChildren again = f.tree.getFilteredChildren(project, false).blockingGet();

    assertSame(project.children(), again);
    verify(f.inventory, times(1)).listInstances("project-1");
    verify(f.trackedProjects, times(1)).projects();
  }

  @Test
  void loadingChildrenPublishesOneResetCycle() {
    InventoryFixture f = InventoryFixture.standard();
    var resets = f.tree.root().children().resets().test();

    f.expandRoot();

    resets.assertValueCount(2);
    resets.assertValueAt(0, r -> r.phase() == ChildrenReset.Phase.CLEARED && r.size() == 0);
    resets.assertValueAt(1, r -> r.phase() == ChildrenReset.Phase.REPLACED && r.size() == 3);
    resets.cancel();
  }

  @Test
  void refreshWithProjectReloadReflectsTrackedProjects() {
    InventoryFixture f = InventoryFixture.standard();
    f.expandRoot();
    f.tracking("project-1");

    f.tree.refresh(true).blockingAwait();

    assertEquals(List.of("[project-1] (project-1)"), texts(f.tree.root().children()));
    verify(f.trackedProjects, times(2)).projects();
  }

  @Test
  void refreshWithoutProjectReloadOnlyResetsZoneCollections() {
    InventoryFixture f = InventoryFixture.standard();
    ProjectNode project = f.expandProject("project-1");
    var rootResets = f.tree.root().children().resets().test();
    var zoneResets = project.children().resets().test();

    f.tree.refresh(false).blockingAwait();

    rootResets.assertNoValues();
    zoneResets.assertValueCount(2);
    verify(f.inventory, times(2)).listInstances("project-1");
    verify(f.inventory, never()).listInstances("project-2");
    verify(f.trackedProjects, times(1)).projects();
    rootResets.cancel();
    zoneResets.cancel();
  }

  @Test
  void refreshWithoutProjectReloadIsNoOpBeforeRootIsLoaded() {
    InventoryFixture f = InventoryFixture.standard();

    f.tree.refresh(false).blockingAwait();

    verify(f.trackedProjects, never()).projects();
  }

  @Test
  void concurrentRequestsShareOneFetch() {
    InventoryFixture f = InventoryFixture.standard();
    f.expandRoot();
    ProjectNode project = f.tree.findProject(new ProjectLocator("project-1"));
    SingleSubject<List<InstanceDescriptor>> pending = SingleSubject.create();
    when(f.inventory.listInstances("project-1")).thenReturn(pending);

    var first = f.tree.getFilteredChildren(project, false).test();
    var second = f.tree.getFilteredChildren(project, true).test();
    first.assertNotComplete();
    second.assertNotComplete();

    pending.onSuccess(List.of(linux(9, "zone-9", "vm-9")));

    first.assertValue(c -> c == project.children());
    second.assertValue(c -> c == project.children());
    verify(f.inventory, times(1)).listInstances("project-1");
    assertEquals(List.of("zone-9"), texts(project.children()));
  }

  @Test
  void requestTakenBeforeFetchCompletesReusesItsResult() {
    InventoryFixture f = InventoryFixture.standard();
    f.expandRoot();
    ProjectNode project = f.tree.findProject(new ProjectLocator("project-1"));
    AtomicInteger backendCalls = new AtomicInteger();
    when(f.inventory.listInstances("project-1"))
        .thenReturn(
            Single.fromCallable(
                () -> {
                  backendCalls.incrementAndGet();
                  return List.of(windows(1, "zone-1", "windows-1"));
                }));
    var resets = project.children().resets().test();

    Single<NodeChildren> first = f.tree.getFilteredChildren(project, false);
    Single<NodeChildren> second = f.tree.getFilteredChildren(project, false);
    first.blockingGet();
    NodeChildren late = second.blockingGet();

    assertSame(project.children(), late);
    assertEquals(1, backendCalls.get());
    resets.assertValueCount(2);
    resets.cancel();
  }

  @Test
  void failedFetchReplaysItsErrorToLateSubscribers() {
    InventoryFixture f = InventoryFixture.standard();
    f.expandRoot();
    ProjectNode project = f.tree.findProject(new ProjectLocator("project-1"));
    AtomicInteger backendCalls = new AtomicInteger();
    when(f.inventory.listInstances("project-1"))
        .thenReturn(
            Single.fromCallable(
                () -> {
                  backendCalls.incrementAndGet();
                  throw new ResourceFetchException("backend unavailable");
                }));

    Single<NodeChildren> first = f.tree.getFilteredChildren(project, false);
    Single<NodeChildren> second = f.tree.getFilteredChildren(project, false);
    first.test().assertError(ResourceFetchException.class);
    second.test().assertError(ResourceFetchException.class);

    assertEquals(1, backendCalls.get());
    assertFalse(project.isLoaded());
  }

  @Test
  void failedReloadKeepsPreviousChildrenAndReportsError() {
    InventoryFixture f = InventoryFixture.standard();
    ProjectNode project = f.expandProject("project-1");
    when(f.inventory.listInstances("project-1"))
        .thenReturn(Single.error(new ResourceFetchException("backend unavailable")));

    var result = f.tree.getFilteredChildren(project, true).test();

    result.assertError(ResourceFetchException.class);
    assertEquals(List.of("zone-1"), texts(project.children()));
    assertTrue(project.isLoaded());
  }

  @Test
  void failureOfWholeProjectListingPropagates() {
    InventoryFixture f = InventoryFixture.standard();
    when(f.inventory.getProject("project-2"))
        .thenReturn(Single.error(new ResourceFetchException("timeout")));

    f.tree
        .getFilteredChildren(f.tree.root(), false)
        .test()
        .assertError(ResourceFetchException.class);

    assertFalse(f.tree.root().isLoaded());
    assertTrue(f.tree.root().children().isEmpty());
  }

  @Test
  void cancellingPendingFetchFailsEveryWaiterAndLeavesCacheUntouched() {
    InventoryFixture f = InventoryFixture.standard();
    ProjectNode project = f.expandProject("project-1");
    SingleSubject<List<InstanceDescriptor>> pending = SingleSubject.create();
    when(f.inventory.listInstances("project-1")).thenReturn(pending);

    var first = f.tree.getFilteredChildren(project, true).test();
    var second = f.tree.getFilteredChildren(project, true).test();
    assertTrue(f.tree.cancelPendingFetch(project));

    first.assertError(CancellationException.class);
    second.assertError(CancellationException.class);
    assertFalse(pending.hasObservers());
    assertEquals(List.of("zone-1"), texts(project.children()));
    assertFalse(f.tree.cancelPendingFetch(project));
  }

  @Test
  void disposingEveryCallerDisposesBackendCallAndAllowsNewFetch() {
    InventoryFixture f = InventoryFixture.standard();
    f.expandRoot();
    ProjectNode project = f.tree.findProject(new ProjectLocator("project-1"));
    SingleSubject<List<InstanceDescriptor>> pending = SingleSubject.create();
    when(f.inventory.listInstances("project-1")).thenReturn(pending);

    var waiter = f.tree.getFilteredChildren(project, false).test();
    assertTrue(pending.hasObservers());
    waiter.dispose();

    assertFalse(pending.hasObservers());
    assertFalse(project.isLoaded());

    when(f.inventory.listInstances("project-1"))
        .thenReturn(Single.just(List.of(windows(1, "zone-1", "windows-1"))));
    f.tree.getFilteredChildren(project, false).test().assertValueCount(1);
    verify(f.inventory, times(2)).listInstances("project-1");
  }

  @Test
  void invalidateForcesNextRequestToFetch() {
    InventoryFixture f = InventoryFixture.standard();
    ProjectNode project = f.expandProject("project-1");

    f.tree.invalidate(project);
    assertFalse(project.isLoaded());
    assertEquals(List.of("zone-1"), texts(project.children()));

    f.tree.getFilteredChildren(project, false).blockingGet();
    verify(f.inventory, times(2)).listInstances("project-1");
  }

  @Test
  void nodesOfAnotherTreeAreRejected() {
    InventoryFixture f = InventoryFixture.standard();
    InventoryFixture other = InventoryFixture.standard();

    assertThrows(
        UnknownResourceException.class,
        () -> f.tree.getFilteredChildren(other.tree.root(), false));
    assertThrows(UnknownResourceException.class, () -> f.tree.invalidate(other.tree.root()));
  }

  @Test
  void zoneDroppedByProjectReloadIsRejected() {
    InventoryFixture f = InventoryFixture.standard();
    InstanceLocator windowsVm = new InstanceLocator("project-1", "zone-1", "windows-1");
    ZoneNode stale = f.expandZone("project-1", "zone-1");
    ProjectNode project = stale.parent();
    assertTrue(f.connectionState.isTracked(windowsVm));

    f.tree.getFilteredChildren(project, true).blockingGet();

    assertNotSame(stale, project.children().get(0));
    assertThrows(UnknownResourceException.class, () -> f.tree.getFilteredChildren(stale, false));
    assertThrows(UnknownResourceException.class, () -> f.tree.invalidate(stale));
    assertFalse(f.connectionState.isTracked(windowsVm));
  }

  @Test
  void zoneDroppedWhileLoadingDoesNotTrackItsInstances() {
    InventoryFixture f = InventoryFixture.standard();
    ProjectNode project = f.expandProject("project-1");
    ZoneNode zone = (ZoneNode) project.children().get(0);
    SingleSubject<List<InstanceDescriptor>> pending = SingleSubject.create();
    when(f.inventory.listInstances("project-1")).thenReturn(pending);

    var zoneLoad = f.tree.getFilteredChildren(zone, false).test();
    f.instances("project-1", linux(3, "zone-3", "linux-3"));
    f.tree.getFilteredChildren(project, true).blockingGet();
    pending.onSuccess(List.of(windows(1, "zone-1", "windows-1")));

    zoneLoad.assertValueCount(1);
    InstanceLocator windowsVm = new InstanceLocator("project-1", "zone-1", "windows-1");
    assertFalse(f.connectionState.isTracked(windowsVm));
  }

  @Test
  void addAndRemoveTrackedProjectReloadRoot() {
    InventoryFixture f = InventoryFixture.standard();
    f.expandRoot();
    ProjectLocator project3 = new ProjectLocator("project-3");
    f.tracking("project-2", "inaccessible-1", "project-1", "project-3")
        .project("project-3", "Third");

    f.tree.addTrackedProject(project3).blockingAwait();

    verify(f.trackedProjects).add(project3);
    assertNotNull(f.tree.findProject(project3));
    assertEquals("Third (project-3)", f.tree.findProject(project3).displayText());

    when(f.trackedProjects.remove(project3)).thenReturn(true);
    f.tracking("project-2", "inaccessible-1", "project-1");
    f.tree.removeTrackedProject(project3).blockingAwait();

    assertEquals(3, f.tree.root().children().size());
    assertNull(f.tree.findProject(project3));
  }

  @Test
  void removingUntrackedProjectDoesNotReload() {
    InventoryFixture f = InventoryFixture.standard();
    f.expandRoot();
    ProjectLocator unknown = new ProjectLocator("unknown");
    when(f.trackedProjects.remove(unknown)).thenReturn(false);

    f.tree.removeTrackedProject(unknown).blockingAwait();

    verify(f.trackedProjects, times(1)).projects();
    assertTrue(f.tree.root().isLoaded());
  }

  @Test
  void filterChangesNeverReachTheBackend() {
    InventoryFixture f = InventoryFixture.standard();
    ZoneNode zone = f.expandZone("project-1", "zone-1");
    var resets = zone.children().resets().test();

    f.tree.applyFilter(FilterState.all().withOperatingSystems(EnumSet.of(OperatingSystem.LINUX)));
    assertEquals(List.of("linux-zone-1"), texts(zone.children()));

    f.tree.applyFilter(FilterState.all().withInstanceNamePattern("WIN"));
    assertEquals(List.of("windows-1"), texts(zone.children()));

    f.tree.applyFilter(FilterState.all());
    assertEquals(List.of("linux-zone-1", "windows-1"), texts(zone.children()));

    resets.assertValueCount(6);
    // One call for the zones, one for the instances of zone-1.
    verify(f.inventory, times(2)).listInstances("project-1");
    resets.cancel();
  }

  @Test
  void newlyLoadedZoneUsesCurrentFilter() {
    InventoryFixture f = InventoryFixture.standard();
    f.tree.applyFilter(FilterState.all().withOperatingSystems(EnumSet.of(OperatingSystem.WINDOWS)));

    ZoneNode zone = f.expandZone("project-1", "zone-1");

    assertEquals(List.of("windows-1"), texts(zone.children()));
  }

  @Test
  void sessionStartedWhileZoneCommitsLeavesInstanceConnected() {
    InventoryFixture f = InventoryFixture.standard();
    InstanceLocator windowsVm = new InstanceLocator("project-1", "zone-1", "windows-1");
    when(f.sessionBroker.isConnected(windowsVm))
        .thenAnswer(
            invocation -> {
              f.bus.sessionStarted(windowsVm);
              return false;
            });

    f.expandZone("project-1", "zone-1");

    assertTrue(f.connectionState.isConnected(windowsVm));
  }

  @Test
  void reloadUnregistersInstancesThatDisappeared() {
    InventoryFixture f = InventoryFixture.standard();
    ZoneNode zone = f.expandZone("project-1", "zone-1");
    InstanceNode windowsVm = (InstanceNode) zone.children().get(1);
    assertTrue(f.connectionState.isTracked(windowsVm.locator()));

    f.instances("project-1", linux(2, "zone-1", "linux-zone-1"));
    f.tree.getFilteredChildren(zone, true).blockingGet();

    assertFalse(f.connectionState.isTracked(windowsVm.locator()));
    assertEquals(List.of("linux-zone-1"), texts(zone.children()));
  }
}
