package cafe.woden.projectexplorer.app.api;

/**
 * The caller lacks permission to read a resource.
 *
 * <p>When raised for a single project during a project listing, the listing recovers by showing
 * the project as inaccessible.
 */
public class ResourceAccessDeniedException extends RuntimeException {

  public ResourceAccessDeniedException(String message) {
    super(message);
  }

  public ResourceAccessDeniedException(String message, Throwable cause) {
    super(message, cause);
  }
}
