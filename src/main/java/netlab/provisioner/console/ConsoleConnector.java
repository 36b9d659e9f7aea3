package netlab.provisioner.console;

import netlab.provisioner.model.ConsoleTarget;

/**
 * Opens console sessions. The returned session is already connected and must be closed by the caller.
 */
@FunctionalInterface
public interface ConsoleConnector {

    /**
     * @throws ConsoleException if the console cannot be reached
     */
    ConsoleSession open(ConsoleTarget target);
}
