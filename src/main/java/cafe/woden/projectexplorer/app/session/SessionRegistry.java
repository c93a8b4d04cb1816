package cafe.woden.projectexplorer.app.session;

import cafe.woden.projectexplorer.app.api.SessionBrokerPort;
import cafe.woden.projectexplorer.model.InstanceLocator;
import io.reactivex.rxjava3.disposables.Disposable;
import jakarta.annotation.PreDestroy;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Session broker that knows every live session, loaded in the tree or not.
 *
 * <p>Used to seed connection state for instances that appear after their session started.
 */
@Component
public class SessionRegistry implements SessionBrokerPort {
  private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

  private final Set<InstanceLocator> live = ConcurrentHashMap.newKeySet();
  private final Disposable eventsSub;

  public SessionRegistry(SessionEventBus bus) {
    this.eventsSub = bus.events().subscribe(this::onEvent, this::onEventError);
  }

  @PreDestroy
  void shutdown() {
    if (!eventsSub.isDisposed()) eventsSub.dispose();
    live.clear();
  }

  @Override
  public boolean isConnected(InstanceLocator instance) {
    return instance != null && live.contains(instance);
  }

  private void onEvent(SessionEvent event) {
    if (event instanceof SessionEvent.Started started) {
      live.add(started.instance());
    } else if (event instanceof SessionEvent.Ended ended) {
      live.remove(ended.instance());
    }
  }

  private void onEventError(Throwable err) {
    log.warn("SessionRegistry event stream failed", err);
  }
}
