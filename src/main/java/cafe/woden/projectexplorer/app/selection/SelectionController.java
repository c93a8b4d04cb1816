package cafe.woden.projectexplorer.app.selection;

import cafe.woden.projectexplorer.app.tree.InstanceNode;
import cafe.woden.projectexplorer.app.tree.ProjectNode;
import cafe.woden.projectexplorer.app.tree.RefreshScope;
import cafe.woden.projectexplorer.app.tree.ResourceNode;
import cafe.woden.projectexplorer.app.tree.ZoneNode;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.processors.BehaviorProcessor;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.springframework.stereotype.Component;

/**
 * Tracks the selected node and what can be done with it.
 *
 * <p>Only {@link #select(ResourceNode)} changes the state; reloads of the tree do not. Selecting a
 * node that has meanwhile been dropped from the tree is not detected here.
 */
@Component
@ApplicationLayer
public class SelectionController {

  /** State emitted on every selection change. */
  public record Selection(ResourceNode node, SelectionState state, CommandVisibility commands) {}

  private final BehaviorProcessor<Selection> selections =
      BehaviorProcessor.createDefault(selectionOf(null));
  private volatile Selection current = selectionOf(null);

  public void select(ResourceNode node) {
    Selection next = selectionOf(node);
    current = next;
    selections.onNext(next);
  }

  public ResourceNode selectedNode() {
    return current.node();
  }

  public SelectionState state() {
    return current.state();
  }

  public CommandVisibility commands() {
    return current.commands();
  }

  public Flowable<Selection> selectionChanges() {
    return selections.onBackpressureLatest();
  }

  /** The project the selection belongs to, or {@code null} for root/no selection. */
  public ProjectNode owningProject() {
    return owningProject(current.node());
  }

  /**
   * What a refresh of the selection reloads.
   *
   * <p>Zones are derived from their project's instance listing, so refreshing a zone or an
   * instance means reloading the zones of the owning project.
   */
  public RefreshScope refreshScope() {
    ProjectNode project = owningProject();
    return project == null ? RefreshScope.allProjects() : RefreshScope.zonesOf(project);
  }

  static ProjectNode owningProject(ResourceNode node) {
    if (node instanceof ProjectNode project) return project;
    if (node instanceof ZoneNode zone) return zone.parent();
    if (node instanceof InstanceNode instance) return instance.parent().parent();
    return null;
  }

  private static Selection selectionOf(ResourceNode node) {
    SelectionState state = SelectionState.of(node);
    return new Selection(node, state, CommandVisibility.forState(state));
  }
}
