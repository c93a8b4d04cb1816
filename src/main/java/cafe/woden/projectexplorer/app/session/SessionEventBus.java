package cafe.woden.projectexplorer.app.session;

import cafe.woden.projectexplorer.model.InstanceLocator;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.processors.FlowableProcessor;
import io.reactivex.rxjava3.processors.PublishProcessor;
import org.springframework.stereotype.Component;

/**
 * Application-wide stream of session lifecycle events.
 *
 * <p>Session windows publish here when a connection is established or closed. Delivery is
 * at-least-once from the publisher's point of view; subscribers must tolerate repeats.
 */
@Component
public class SessionEventBus {

  private final FlowableProcessor<SessionEvent> events =
      PublishProcessor.<SessionEvent>create().toSerialized();

  public void publish(SessionEvent event) {
    if (event == null) return;
    events.onNext(event);
  }

  public void sessionStarted(InstanceLocator instance) {
    if (instance == null) return;
    publish(new SessionEvent.Started(instance));
  }

  public void sessionEnded(InstanceLocator instance) {
    if (instance == null) return;
    publish(new SessionEvent.Ended(instance));
  }

  public Flowable<SessionEvent> events() {
    return events.onBackpressureBuffer();
  }
}
