package cafe.woden.projectexplorer.app.session;

import cafe.woden.projectexplorer.model.InstanceLocator;
import java.util.Objects;

/** Lifecycle of a remote session (RDP/SSH) to an instance. */
public sealed interface SessionEvent permits SessionEvent.Started, SessionEvent.Ended {

  InstanceLocator instance();

  record Started(InstanceLocator instance) implements SessionEvent {
    public Started {
      Objects.requireNonNull(instance, "instance");
    }
  }

  record Ended(InstanceLocator instance) implements SessionEvent {
    public Ended {
      Objects.requireNonNull(instance, "instance");
    }
  }
}
