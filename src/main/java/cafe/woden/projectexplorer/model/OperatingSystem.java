package cafe.woden.projectexplorer.model;

import java.util.Collection;
import java.util.Locale;
import java.util.Objects;

/** Guest operating-system family of an instance. */
public enum OperatingSystem {
  WINDOWS,
  LINUX;

  /** Guest-OS feature reported by attached disks of Windows images. */
  public static final String WINDOWS_GUEST_OS_FEATURE = "WINDOWS";

  /**
   * Derives the OS family from the guest-OS features of all attached disks.
   *
   * <p>Any disk reporting {@link #WINDOWS_GUEST_OS_FEATURE} makes the instance Windows; everything
   * else (including no disks at all) is treated as Linux.
   */
  public static OperatingSystem fromGuestOsFeatures(Collection<String> features) {
    if (features == null) return LINUX;
    for (String feature : features) {
      String f = Objects.toString(feature, "").trim().toUpperCase(Locale.ROOT);
      if (WINDOWS_GUEST_OS_FEATURE.equals(f)) return WINDOWS;
    }
    return LINUX;
  }
}
