package cafe.woden.projectexplorer.inventory;

import cafe.woden.projectexplorer.app.api.InventoryPort;
import cafe.woden.projectexplorer.config.ExplorerProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Fallback for {@link InventoryPort}.
 *
 * <p>A backend adapter registered elsewhere replaces the offline inventory.
 */
@Configuration
public class InventoryConfig {

  @Bean
  @ConditionalOnMissingBean(InventoryPort.class)
  public InventoryPort offlineInventory(ExplorerProperties props) {
    return new OfflineInventoryAdapter(props);
  }
}
