package cafe.woden.projectexplorer.app.api;

/** An operation referenced a node or identity that is not (or no longer) known. */
public class UnknownResourceException extends IllegalArgumentException {

  public UnknownResourceException(String message) {
    super(message);
  }
}
