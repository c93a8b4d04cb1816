package cafe.woden.projectexplorer.app.api;

/** A network or backend failure while reading the inventory. Never recovered locally. */
public class ResourceFetchException extends RuntimeException {

  public ResourceFetchException(String message) {
    super(message);
  }

  public ResourceFetchException(String message, Throwable cause) {
    super(message, cause);
  }
}
