package cafe.woden.projectexplorer.console;

import cafe.woden.projectexplorer.app.api.CloudConsolePort;
import cafe.woden.projectexplorer.config.ExplorerProperties;
import cafe.woden.projectexplorer.model.InstanceLocator;
import cafe.woden.projectexplorer.model.ProjectLocator;
import cafe.woden.projectexplorer.model.ZoneLocator;
import java.awt.Desktop;
import java.awt.GraphicsEnvironment;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import org.jmolecules.architecture.layered.InfrastructureLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Opens cloud console pages in the system browser. */
@Component
@InfrastructureLayer
public class DesktopCloudConsoleLauncher implements CloudConsolePort {
  private static final Logger log = LoggerFactory.getLogger(DesktopCloudConsoleLauncher.class);

  /** Hands a URI to whatever displays it. */
  @FunctionalInterface
  interface Browser {
    void browse(URI uri) throws Exception;
  }

  private final String baseUrl;
  private final Browser browser;

  @Autowired
  public DesktopCloudConsoleLauncher(ExplorerProperties props) {
    this(props, DesktopCloudConsoleLauncher::browseWithDesktop);
  }

  DesktopCloudConsoleLauncher(ExplorerProperties props, Browser browser) {
    this.baseUrl = Objects.requireNonNull(props, "props").console().baseUrl();
    this.browser = Objects.requireNonNull(browser, "browser");
  }

  @Override
  public void openInstanceList(ProjectLocator project) {
    open(instanceListUrl(project));
  }

  @Override
  public void openInstanceList(ZoneLocator zone) {
    open(instanceListUrl(zone));
  }

  @Override
  public void openInstanceDetails(InstanceLocator instance) {
    open(instanceDetailsUrl(instance));
  }

  @Override
  public void openIapConfiguration(String projectId) {
    open(iapConfigurationUrl(projectId));
  }

  URI instanceListUrl(ProjectLocator project) {
    return URI.create(baseUrl + "/compute/instances?project=" + enc(project.projectId()));
  }

  URI instanceListUrl(ZoneLocator zone) {
    return URI.create(
        baseUrl
            + "/compute/instances?project="
            + enc(zone.projectId())
            + "&zone="
            + enc(zone.name()));
  }

  URI instanceDetailsUrl(InstanceLocator instance) {
    return URI.create(
        baseUrl
            + "/compute/instancesDetail/zones/"
            + enc(instance.zone())
            + "/instances/"
            + enc(instance.name())
            + "?project="
            + enc(instance.projectId()));
  }

  URI iapConfigurationUrl(String projectId) {
    String id = Objects.toString(projectId, "").trim();
    if (id.isEmpty()) throw new IllegalArgumentException("projectId must not be blank");
    return URI.create(baseUrl + "/security/iap?tab=ssh-tcp-resources&project=" + enc(id));
  }

  private void open(URI uri) {
    try {
      browser.browse(uri);
      log.debug("[console] opened {}", uri);
    } catch (Exception e) {
      log.warn("[console] could not open {}", uri, e);
    }
  }

  private static void browseWithDesktop(URI uri) throws Exception {
    if (GraphicsEnvironment.isHeadless()
        || !Desktop.isDesktopSupported()
        || !Desktop.getDesktop().isSupported(Desktop.Action.BROWSE)) {
      log.info("[console] no desktop browser available; open {} manually", uri);
      return;
    }
    Desktop.getDesktop().browse(uri);
  }

  private static String enc(String s) {
    return URLEncoder.encode(Objects.toString(s, ""), StandardCharsets.UTF_8);
  }
}
