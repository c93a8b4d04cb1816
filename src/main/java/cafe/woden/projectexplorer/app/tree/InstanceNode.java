package cafe.woden.projectexplorer.app.tree;

import cafe.woden.projectexplorer.app.session.ConnectionStateTracker;
import cafe.woden.projectexplorer.model.InstanceLocator;
import cafe.woden.projectexplorer.model.InstanceStatus;
import cafe.woden.projectexplorer.model.OperatingSystem;
import java.util.Objects;

/**
 * A VM instance. Leaf of the hierarchy.
 *
 * <p>{@link #isConnected()} is read through to the {@link ConnectionStateTracker} on every call.
 */
public final class InstanceNode extends ResourceNode {

  private final InstanceLocator locator;
  private final OperatingSystem operatingSystem;
  private final InstanceStatus status;
  private final ConnectionStateTracker connectionState;

  InstanceNode(
      ZoneNode parent,
      InstanceLocator locator,
      OperatingSystem operatingSystem,
      InstanceStatus status,
      ConnectionStateTracker connectionState) {
    super(Objects.requireNonNull(parent, "parent"));
    this.locator = Objects.requireNonNull(locator, "locator");
    this.operatingSystem = operatingSystem == null ? OperatingSystem.LINUX : operatingSystem;
    this.status = status == null ? InstanceStatus.OTHER : status;
    this.connectionState = Objects.requireNonNull(connectionState, "connectionState");
  }

  @Override
  public NodeKind kind() {
    return NodeKind.INSTANCE;
  }

  @Override
  public InstanceLocator locator() {
    return locator;
  }

  @Override
  public ZoneNode parent() {
    return (ZoneNode) super.parent();
  }

  public OperatingSystem operatingSystem() {
    return operatingSystem;
  }

  public boolean isWindows() {
    return operatingSystem == OperatingSystem.WINDOWS;
  }

  public InstanceStatus status() {
    return status;
  }

  public boolean isRunning() {
    return status == InstanceStatus.RUNNING;
  }

  public boolean isStopped() {
    return status == InstanceStatus.STOPPED;
  }

  public boolean isConnected() {
    return connectionState.isConnected(locator);
  }

  @Override
  public String displayText() {
    return locator.name();
  }

  @Override
  public NodeImage imageVariant() {
    boolean connected = isConnected();
    if (isWindows()) {
      if (connected) return NodeImage.WINDOWS_CONNECTED;
      return isStopped() ? NodeImage.WINDOWS_STOPPED : NodeImage.WINDOWS_DISCONNECTED;
    }
    if (connected) return NodeImage.LINUX_CONNECTED;
    return isStopped() ? NodeImage.LINUX_STOPPED : NodeImage.LINUX_DISCONNECTED;
  }
}
