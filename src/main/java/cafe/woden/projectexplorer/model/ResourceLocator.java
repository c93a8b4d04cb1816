package cafe.woden.projectexplorer.model;

/** Identity of a project, zone, or instance within the resource hierarchy. */
public sealed interface ResourceLocator permits ProjectLocator, ZoneLocator, InstanceLocator {

  String projectId();

  /** The last path segment: project id, zone name, or instance name. */
  String name();

  /** Resource path in the form used by the Compute Engine API. */
  String path();
}
