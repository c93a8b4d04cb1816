package cafe.woden.projectexplorer.app.core;

import cafe.woden.projectexplorer.app.api.CloudConsolePort;
import cafe.woden.projectexplorer.app.api.FilterSettingsPort;
import cafe.woden.projectexplorer.app.selection.CommandVisibility;
import cafe.woden.projectexplorer.app.selection.SelectionController;
import cafe.woden.projectexplorer.app.tree.FilterState;
import cafe.woden.projectexplorer.app.tree.InstanceNode;
import cafe.woden.projectexplorer.app.tree.NodeChildren;
import cafe.woden.projectexplorer.app.tree.ProjectNode;
import cafe.woden.projectexplorer.app.tree.ResourceNode;
import cafe.woden.projectexplorer.app.tree.ResourceTree;
import cafe.woden.projectexplorer.app.tree.RootNode;
import cafe.woden.projectexplorer.app.tree.ZoneNode;
import cafe.woden.projectexplorer.model.OperatingSystem;
import cafe.woden.projectexplorer.model.ProjectLocator;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Single;
import java.beans.PropertyChangeListener;
import java.beans.PropertyChangeSupport;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Entry point for a project explorer view: filters, selection and the commands offered on it.
 *
 * <p>The operating-system filter survives restarts through {@link FilterSettingsPort}; the
 * instance name filter does not.
 */
@Component
@ApplicationLayer
public class ProjectExplorer {
  private static final Logger log = LoggerFactory.getLogger(ProjectExplorer.class);

  public static final String PROP_OPERATING_SYSTEMS_FILTER = "operatingSystemsFilter";
  public static final String PROP_WINDOWS_INCLUDED = "windowsIncluded";
  public static final String PROP_LINUX_INCLUDED = "linuxIncluded";
  public static final String PROP_INSTANCE_FILTER = "instanceFilter";

  private final ResourceTree tree;
  private final SelectionController selection;
  private final CloudConsolePort cloudConsole;
  private final FilterSettingsPort filterSettings;
  private final PropertyChangeSupport pcs = new PropertyChangeSupport(this);

  public ProjectExplorer(
      ResourceTree tree,
      SelectionController selection,
      CloudConsolePort cloudConsole,
      FilterSettingsPort filterSettings) {
    this.tree = Objects.requireNonNull(tree, "tree");
    this.selection = Objects.requireNonNull(selection, "selection");
    this.cloudConsole = Objects.requireNonNull(cloudConsole, "cloudConsole");
    this.filterSettings = Objects.requireNonNull(filterSettings, "filterSettings");

    EnumSet<OperatingSystem> os = EnumSet.noneOf(OperatingSystem.class);
    if (filterSettings.readWindowsIncluded(true)) os.add(OperatingSystem.WINDOWS);
    if (filterSettings.readLinuxIncluded(true)) os.add(OperatingSystem.LINUX);
    tree.applyFilter(tree.filter().withOperatingSystems(os));
  }

  public RootNode rootNode() {
    return tree.root();
  }

  public Single<NodeChildren> expandRoot() {
    return tree.getFilteredChildren(tree.root(), false);
  }

  public Single<NodeChildren> getFilteredChildren(ResourceNode node, boolean forceReload) {
    return tree.getFilteredChildren(node, forceReload);
  }

  // Filters.

  public Set<OperatingSystem> operatingSystemsFilter() {
    return tree.filter().operatingSystems();
  }

  public void setOperatingSystemsFilter(Set<OperatingSystem> operatingSystems) {
    FilterState prev = tree.filter();
    FilterState next = prev.withOperatingSystems(operatingSystems);
    if (prev.operatingSystems().equals(next.operatingSystems())) return;

    tree.applyFilter(next);
    filterSettings.rememberOperatingSystemsFilter(
        next.includes(OperatingSystem.WINDOWS), next.includes(OperatingSystem.LINUX));

    pcs.firePropertyChange(
        PROP_OPERATING_SYSTEMS_FILTER, prev.operatingSystems(), next.operatingSystems());
    pcs.firePropertyChange(
        PROP_WINDOWS_INCLUDED,
        prev.includes(OperatingSystem.WINDOWS),
        next.includes(OperatingSystem.WINDOWS));
    pcs.firePropertyChange(
        PROP_LINUX_INCLUDED,
        prev.includes(OperatingSystem.LINUX),
        next.includes(OperatingSystem.LINUX));
  }

  public boolean isWindowsIncluded() {
    return tree.filter().includes(OperatingSystem.WINDOWS);
  }

  public void setWindowsIncluded(boolean included) {
    setIncluded(OperatingSystem.WINDOWS, included);
  }

  public boolean isLinuxIncluded() {
    return tree.filter().includes(OperatingSystem.LINUX);
  }

  public void setLinuxIncluded(boolean included) {
    setIncluded(OperatingSystem.LINUX, included);
  }

  public String instanceFilter() {
    return tree.filter().instanceNamePattern();
  }

  public void setInstanceFilter(String pattern) {
    FilterState prev = tree.filter();
    FilterState next = prev.withInstanceNamePattern(pattern);
    if (Objects.equals(prev.instanceNamePattern(), next.instanceNamePattern())) return;

    tree.applyFilter(next);
    pcs.firePropertyChange(
        PROP_INSTANCE_FILTER, prev.instanceNamePattern(), next.instanceNamePattern());
  }

  public void addPropertyChangeListener(PropertyChangeListener l) {
    pcs.addPropertyChangeListener(l);
  }

  public void removePropertyChangeListener(PropertyChangeListener l) {
    pcs.removePropertyChangeListener(l);
  }

  // Projects and refresh.

  public Completable addProject(ProjectLocator project) {
    return tree.addTrackedProject(project);
  }

  public Completable removeProject(ProjectLocator project) {
    return tree.removeTrackedProject(project);
  }

  public Completable refresh(boolean reloadProjects) {
    return tree.refresh(reloadProjects);
  }

  public Completable refreshSelectedNode() {
    return tree.refresh(selection.refreshScope());
  }

  // Selection and commands.

  public ResourceNode selectedNode() {
    return selection.selectedNode();
  }

  public void setSelectedNode(ResourceNode node) {
    selection.select(node);
  }

  public CommandVisibility commandVisibility() {
    return selection.commands();
  }

  public Completable unloadSelectedProject() {
    if (!(selection.selectedNode() instanceof ProjectNode project)) {
      log.debug("unload ignored, selection is not a project");
      return Completable.complete();
    }
    return tree.removeTrackedProject(project.locator());
  }

  public void openInCloudConsole() {
    ResourceNode node = selection.selectedNode();
    if (node instanceof ProjectNode project) {
      cloudConsole.openInstanceList(project.locator());
    } else if (node instanceof ZoneNode zone) {
      cloudConsole.openInstanceList(zone.locator());
    } else if (node instanceof InstanceNode instance) {
      cloudConsole.openInstanceDetails(instance.locator());
    }
  }

  public void configureIapAccess() {
    ProjectNode project = selection.owningProject();
    if (project == null) return;
    cloudConsole.openIapConfiguration(project.projectId());
  }

  private void setIncluded(OperatingSystem os, boolean included) {
    EnumSet<OperatingSystem> next = EnumSet.noneOf(OperatingSystem.class);
    next.addAll(operatingSystemsFilter());
    if (included) {
      next.add(os);
    } else {
      next.remove(os);
    }
    setOperatingSystemsFilter(next);
  }
}
