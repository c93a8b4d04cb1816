@NamedInterface("tree")
package cafe.woden.projectexplorer.app.tree;

import org.springframework.modulith.NamedInterface;
