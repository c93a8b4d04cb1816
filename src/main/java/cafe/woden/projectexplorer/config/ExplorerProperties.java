package cafe.woden.projectexplorer.config;

import java.util.List;
import java.util.Objects;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Project explorer configuration.
 *
 * <p>Example YAML:
 * <pre>
 * explorer:
 *   projects: [project-1, project-2]
 *   filter:
 *     windows-included: true
 *     linux-included: false
 * </pre>
 *
 * <p>{@code projects} only seeds the runtime config on first start; afterwards the tracked list is
 * whatever the user left in the runtime file.
 */
@ConfigurationProperties(prefix = "explorer")
public record ExplorerProperties(
    List<String> projects, Filter filter, Console console, Offline offline, Startup startup) {

  public ExplorerProperties {
    projects = projects == null ? List.of() : List.copyOf(projects);
    if (filter == null) filter = new Filter(true, true);
    if (console == null) console = new Console(null);
    if (offline == null) offline = new Offline(List.of());
    if (startup == null) startup = new Startup(false);
  }

  /** Operating-system filter used until the user changes it. */
  public record Filter(Boolean windowsIncluded, Boolean linuxIncluded) {
    public Filter {
      if (windowsIncluded == null) windowsIncluded = Boolean.TRUE;
      if (linuxIncluded == null) linuxIncluded = Boolean.TRUE;
    }
  }

  public record Console(String baseUrl) {
    public static final String DEFAULT_BASE_URL = "https://console.cloud.google.com";

    public Console {
      String url = Objects.toString(baseUrl, "").trim();
      while (url.endsWith("/")) url = url.substring(0, url.length() - 1);
      baseUrl = url.isEmpty() ? DEFAULT_BASE_URL : url;
    }
  }

  /**
   * Inventory served without a backend connection.
   *
   * <p>Projects marked {@code accessible: false} answer every request with an access-denied error.
   */
  public record Offline(List<Project> projects) {
    public Offline {
      projects = projects == null ? List.of() : List.copyOf(projects);
    }

    public record Project(String id, String displayName, Boolean accessible, List<Instance> instances) {
      public Project {
        id = Objects.toString(id, "").trim();
        if (accessible == null) accessible = Boolean.TRUE;
        instances = instances == null ? List.of() : List.copyOf(instances);
      }
    }

    /** {@code os} is {@code windows} or {@code linux}; {@code status} uses the backend's names. */
    public record Instance(Long id, String zone, String name, String os, String status) {
      public Instance {
        if (id == null) id = 0L;
        if (os == null || os.isBlank()) os = "linux";
        if (status == null || status.isBlank()) status = "RUNNING";
      }
    }
  }

  public record Startup(Boolean preloadRoot) {
    public Startup {
      if (preloadRoot == null) preloadRoot = Boolean.FALSE;
    }
  }
}
