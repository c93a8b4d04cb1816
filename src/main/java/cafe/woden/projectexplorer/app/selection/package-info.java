@NamedInterface("selection")
package cafe.woden.projectexplorer.app.selection;

import org.springframework.modulith.NamedInterface;
