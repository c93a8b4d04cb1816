@NamedInterface("api")
package cafe.woden.projectexplorer.app.api;

import org.springframework.modulith.NamedInterface;
