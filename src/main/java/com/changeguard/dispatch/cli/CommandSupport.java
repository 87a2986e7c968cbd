package com.changeguard.dispatch.cli;

import com.changeguard.core.exception.ChangeguardException;
import com.changeguard.core.exception.RollbackFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;

/**
 * Base for subcommands: turns pipeline errors into a red error line and exit code 1.
 * A failed rollback exits with 2 because the working tree needs manual repair.
 */
abstract class CommandSupport implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CommandSupport.class);

    @Override
    public Integer call() {
        try {
            return execute();
        } catch (RollbackFailedException e) {
            ConsoleOutput.error("MANUAL INTERVENTION REQUIRED: " + e.getMessage());
            ConsoleOutput.error("Original content is in " + e.getBackupPath());
            return 2;
        } catch (ChangeguardException | IllegalArgumentException e) {
            log.debug("Command failed", e);
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }

    protected abstract int execute();
}
