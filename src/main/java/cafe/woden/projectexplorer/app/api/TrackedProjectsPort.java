package cafe.woden.projectexplorer.app.api;

import cafe.woden.projectexplorer.model.ProjectLocator;
import java.util.List;

/** Persisted set of projects the user chose to include in the tree. */
public interface TrackedProjectsPort {

  List<ProjectLocator> projects();

  void add(ProjectLocator project);

  /** @return false if the project was not tracked */
  boolean remove(ProjectLocator project);
}
