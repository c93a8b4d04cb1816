package cafe.woden.projectexplorer.app.selection;

/** Which tree commands a UI should offer for the current selection. */
public record CommandVisibility(
    boolean unloadProject,
    boolean refreshSubtree,
    boolean refreshAllProjects,
    boolean openInConsole,
    boolean configureAccess) {

  public static CommandVisibility forState(SelectionState state) {
    SelectionState st = state == null ? SelectionState.NO_SELECTION : state;
    return switch (st) {
      case NO_SELECTION, ROOT_SELECTED -> new CommandVisibility(false, false, true, false, false);
      case PROJECT_SELECTED -> new CommandVisibility(true, true, false, true, true);
      case ZONE_SELECTED, INSTANCE_SELECTED ->
          new CommandVisibility(false, true, false, true, true);
    };
  }
}
