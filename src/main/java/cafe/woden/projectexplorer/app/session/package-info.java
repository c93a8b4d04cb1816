@NamedInterface("session")
package cafe.woden.projectexplorer.app.session;

import org.springframework.modulith.NamedInterface;
