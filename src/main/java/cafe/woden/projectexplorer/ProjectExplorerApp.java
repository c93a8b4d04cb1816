package cafe.woden.projectexplorer;

import cafe.woden.projectexplorer.app.tree.ProjectNode;
import cafe.woden.projectexplorer.app.tree.ResourceTree;
import cafe.woden.projectexplorer.config.ExplorerProperties;
import cafe.woden.projectexplorer.config.RuntimeConfigStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.modulith.Modulithic;

@SpringBootApplication
@Modulithic(
    systemName = "Project Explorer",
    sharedModules = {"config", "model"})
@EnableConfigurationProperties(ExplorerProperties.class)
public class ProjectExplorerApp {
  private static final Logger log = LoggerFactory.getLogger(ProjectExplorerApp.class);

  public static void main(String[] args) {
    // Not headless: the console launcher hands URLs to the desktop browser.
    new SpringApplicationBuilder(ProjectExplorerApp.class).headless(false).run(args);
  }

  @Bean
  public ApplicationRunner preloadRoot(
      ExplorerProperties props, RuntimeConfigStore runtimeConfig, ResourceTree tree) {
    return args -> {
      log.info("[explorer] runtime config: {}", runtimeConfig.runtimeConfigPath());
      if (!props.startup().preloadRoot()) return;

      tree.getFilteredChildren(tree.root(), false)
          .subscribe(
              children -> {
                long inaccessible =
                    children.stream()
                        .filter(n -> n instanceof ProjectNode p && !p.isAccessible())
                        .count();
                log.info(
                    "[explorer] {} project(s) loaded, {} inaccessible",
                    children.size(),
                    inaccessible);
              },
              err -> log.warn("[explorer] could not load projects", err));
    };
  }
}
