package cafe.woden.projectexplorer.app.api;

/** Persistence for the operating-system filter between sessions. */
public interface FilterSettingsPort {

  boolean readWindowsIncluded(boolean defaultValue);

  boolean readLinuxIncluded(boolean defaultValue);

  void rememberOperatingSystemsFilter(boolean windowsIncluded, boolean linuxIncluded);
}
