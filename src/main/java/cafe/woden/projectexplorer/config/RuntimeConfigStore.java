package cafe.woden.projectexplorer.config;

import cafe.woden.projectexplorer.app.api.FilterSettingsPort;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.jmolecules.architecture.layered.InfrastructureLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads and writes the user's runtime YAML.
 *
 * <p>The file mirrors the {@code explorer} properties tree so it can also be passed to Spring as an
 * additional config location. Failures are logged and otherwise ignored: losing a remembered
 * setting must never break the explorer.
 */
@Component
@InfrastructureLayer
public class RuntimeConfigStore implements FilterSettingsPort {

  private static final Logger log = LoggerFactory.getLogger(RuntimeConfigStore.class);

  private final Path file;
  private final ExplorerProperties defaults;
  private final Yaml yaml;

  public RuntimeConfigStore(
      @Value("${explorer.runtime-config:${user.home}/.config/project-explorer/explorer.yml}")
          String filePath,
      ExplorerProperties defaults) {
    this.file = Paths.get(Objects.requireNonNullElse(filePath, "").trim());
    this.defaults = defaults;

    DumperOptions opts = new DumperOptions();
    opts.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    opts.setPrettyFlow(true);
    opts.setIndent(2);
    // indicatorIndent must stay below indent.
    opts.setIndicatorIndent(1);
    opts.setDefaultScalarStyle(DumperOptions.ScalarStyle.PLAIN);
    this.yaml = new Yaml(opts);

    ensureFileExistsWithProjects();
  }

  public Path runtimeConfigPath() {
    return file;
  }

  /** Creates the file on first start, seeding {@code explorer.projects} from the defaults. */
  public synchronized void ensureFileExistsWithProjects() {
    try {
      if (file.toString().isBlank()) return;

      Map<String, Object> doc = Files.exists(file) ? loadFile() : new LinkedHashMap<>();
      Map<String, Object> explorer = getOrCreateMap(doc, "explorer");

      // An existing key wins, even when empty. That is what makes removals stick.
      if (!explorer.containsKey("projects")) {
        List<String> seeded = new ArrayList<>();
        if (defaults != null) seeded.addAll(defaults.projects());
        explorer.put("projects", seeded);
        writeFile(doc);
      }
    } catch (Exception e) {
      log.warn("[explorer] Could not ensure runtime config file '{}'", file, e);
    }
  }

  /** Returns the tracked project ids in stored order, or the configured defaults. */
  public synchronized List<String> readTrackedProjects() {
    List<String> fallback = defaults == null ? List.of() : defaults.projects();
    try {
      if (file.toString().isBlank() || !Files.exists(file)) return fallback;

      Object o = explorerSection(loadFile()).map(m -> m.get("projects")).orElse(null);
      if (!(o instanceof List<?> list)) return fallback;

      List<String> out = new ArrayList<>();
      for (Object item : list) {
        String id = Objects.toString(item, "").trim();
        if (!id.isEmpty() && !out.contains(id)) out.add(id);
      }
      return out;
    } catch (Exception e) {
      log.warn("[explorer] Could not read tracked projects from '{}'", file, e);
      return fallback;
    }
  }

  public synchronized void writeTrackedProjects(List<String> projectIds) {
    try {
      if (file.toString().isBlank()) return;

      Map<String, Object> doc = Files.exists(file) ? loadFile() : new LinkedHashMap<>();
      Map<String, Object> explorer = getOrCreateMap(doc, "explorer");
      explorer.put("projects", projectIds == null ? new ArrayList<>() : new ArrayList<>(projectIds));
      writeFile(doc);
    } catch (Exception e) {
      log.warn("[explorer] Could not persist tracked projects to '{}'", file, e);
    }
  }

  @Override
  public boolean readWindowsIncluded(boolean defaultValue) {
    return readFilterFlag("windowsIncluded")
        .orElse(defaults == null ? defaultValue : defaults.filter().windowsIncluded());
  }

  @Override
  public boolean readLinuxIncluded(boolean defaultValue) {
    return readFilterFlag("linuxIncluded")
        .orElse(defaults == null ? defaultValue : defaults.filter().linuxIncluded());
  }

  @Override
  public synchronized void rememberOperatingSystemsFilter(
      boolean windowsIncluded, boolean linuxIncluded) {
    try {
      if (file.toString().isBlank()) return;

      Map<String, Object> doc = Files.exists(file) ? loadFile() : new LinkedHashMap<>();
      Map<String, Object> explorer = getOrCreateMap(doc, "explorer");
      Map<String, Object> filter = getOrCreateMap(explorer, "filter");
      filter.put("windowsIncluded", windowsIncluded);
      filter.put("linuxIncluded", linuxIncluded);
      writeFile(doc);
    } catch (Exception e) {
      log.warn("[explorer] Could not persist operating system filter to '{}'", file, e);
    }
  }

  private synchronized Optional<Boolean> readFilterFlag(String key) {
    try {
      if (file.toString().isBlank() || !Files.exists(file)) return Optional.empty();

      Object filterObj = explorerSection(loadFile()).map(m -> m.get("filter")).orElse(null);
      if (!(filterObj instanceof Map<?, ?> filter)) return Optional.empty();

      Object v = filter.get(key);
      if (v instanceof Boolean b) return Optional.of(b);
      if (v instanceof String s) {
        String t = s.trim();
        if (t.equalsIgnoreCase("true")) return Optional.of(Boolean.TRUE);
        if (t.equalsIgnoreCase("false")) return Optional.of(Boolean.FALSE);
      }
      return Optional.empty();
    } catch (Exception e) {
      log.warn("[explorer] Could not read filter.{} from '{}'", key, file, e);
      return Optional.empty();
    }
  }

  private static Optional<Map<?, ?>> explorerSection(Map<String, Object> doc) {
    Object o = doc.get("explorer");
    return o instanceof Map<?, ?> m ? Optional.of(m) : Optional.empty();
  }

  @SuppressWarnings("unchecked")
  private Map<String, Object> loadFile() throws IOException {
    try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      Object o = yaml.load(r);
      if (o instanceof Map<?, ?> m) {
        return (Map<String, Object>) m;
      }
      return new LinkedHashMap<>();
    }
  }

  private void writeFile(Map<String, Object> doc) throws IOException {
    Path parent = file.getParent();
    if (parent != null && !Files.exists(parent)) {
      Files.createDirectories(parent);
    }
    try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
      yaml.dump(doc, w);
    }
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> getOrCreateMap(Map<String, Object> parent, String key) {
    Object o = parent.get(key);
    if (o instanceof Map<?, ?> m) return (Map<String, Object>) m;
    Map<String, Object> created = new LinkedHashMap<>();
    parent.put(key, created);
    return created;
  }
}
