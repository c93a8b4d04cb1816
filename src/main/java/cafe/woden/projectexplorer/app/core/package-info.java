@NamedInterface("core")
package cafe.woden.projectexplorer.app.core;

import org.springframework.modulith.NamedInterface;
