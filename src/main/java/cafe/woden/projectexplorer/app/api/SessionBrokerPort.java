package cafe.woden.projectexplorer.app.api;

import cafe.woden.projectexplorer.model.InstanceLocator;

/** Point-in-time view of live remote sessions. */
public interface SessionBrokerPort {

  boolean isConnected(InstanceLocator instance);
}
