package cafe.woden.projectexplorer.app.session;

import cafe.woden.projectexplorer.app.api.SessionBrokerPort;
import cafe.woden.projectexplorer.model.InstanceLocator;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.disposables.Disposable;
import io.reactivex.rxjava3.processors.FlowableProcessor;
import io.reactivex.rxjava3.processors.PublishProcessor;
import jakarta.annotation.PreDestroy;
import java.util.Collection;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Connected/disconnected state of the instances currently loaded in the tree.
 *
 * <p>Instances are registered when a zone listing is committed and seeded from the session broker.
 * Afterwards only session events change their state. Events for instances that are not registered
 * are ignored.
 */
@Component
@ApplicationLayer
public class ConnectionStateTracker {
  private static final Logger log = LoggerFactory.getLogger(ConnectionStateTracker.class);

  private final SessionBrokerPort sessionBroker;
  private final Set<InstanceLocator> loaded = new HashSet<>();
  private final Set<InstanceLocator> connected = new HashSet<>();
  // Registered, broker not answered yet.
  private final Set<InstanceLocator> seeding = new HashSet<>();
  private final FlowableProcessor<InstanceLocator> changes =
      PublishProcessor.<InstanceLocator>create().toSerialized();
  private final Disposable eventsSub;

  public ConnectionStateTracker(SessionEventBus bus, SessionBrokerPort sessionBroker) {
    this.sessionBroker = Objects.requireNonNull(sessionBroker, "sessionBroker");
    this.eventsSub = bus.events().subscribe(this::onEvent, this::onEventError);
  }

  @PreDestroy
  void shutdown() {
    if (!eventsSub.isDisposed()) eventsSub.dispose();
    synchronized (this) {
      loaded.clear();
      seeding.clear();
      connected.clear();
    }
  }

  public synchronized boolean isConnected(InstanceLocator instance) {
    return instance != null && connected.contains(instance);
  }

  public synchronized boolean isTracked(InstanceLocator instance) {
    return instance != null && loaded.contains(instance);
  }

  /** Emits the instance whose connected flag just flipped. */
  public Flowable<InstanceLocator> connectionChanges() {
    return changes.onBackpressureBuffer();
  }

  /**
   * Starts tracking newly loaded instances, seeding each from the session broker.
   *
   * <p>An instance accepts session events from the moment it is registered. A seed is dropped when
   * an event for the same instance arrived while the broker was being asked.
   */
  public void register(Collection<InstanceLocator> instances) {
    if (instances == null || instances.isEmpty()) return;
    for (InstanceLocator instance : instances) {
      if (instance == null) continue;
      synchronized (this) {
        loaded.add(instance);
        seeding.add(instance);
      }
      boolean live = sessionBroker.isConnected(instance);
      boolean changed;
      synchronized (this) {
        if (!seeding.remove(instance)) {
          log.debug("[{}] seed skipped, state changed while asking the broker", instance);
          continue;
        }
        changed = live ? connected.add(instance) : connected.remove(instance);
      }
      if (changed) changes.onNext(instance);
    }
  }

  /** Forgets instances that are no longer part of the tree. */
  public void unregister(Collection<InstanceLocator> instances) {
    if (instances == null || instances.isEmpty()) return;
    synchronized (this) {
      for (InstanceLocator instance : instances) {
        if (instance == null) continue;
        loaded.remove(instance);
        seeding.remove(instance);
        connected.remove(instance);
      }
    }
  }

  private void onEvent(SessionEvent event) {
    if (event == null) return;
    InstanceLocator instance = event.instance();
    boolean changed;
    synchronized (this) {
      if (!loaded.contains(instance)) {
        log.debug("[{}] session event ignored, instance not loaded", instance);
        return;
      }
      seeding.remove(instance);
      changed =
          event instanceof SessionEvent.Started
              ? connected.add(instance)
              : connected.remove(instance);
    }
    if (changed) changes.onNext(instance);
  }

  private void onEventError(Throwable err) {
    log.warn("ConnectionStateTracker event stream failed", err);
  }
}
