package org.janelia.astrometry.client;

import org.janelia.astrometry.AstrometryException;
import org.janelia.astrometry.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps a command line client with entry and exit log statements and maps its outcome to a process exit status:
 *
 * <pre>
 *   0  the client completed
 *   1  the client failed unexpectedly (bad input files, bugs, ...)
 *   2  the image could not be solved
 * </pre>
 *
 * Absence of the exit log message indicates that the client was terminated abnormally.
 */
public abstract class ClientRunner {

    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_UNSOLVED = 2;

    private final String[] args;

    /**
     * @param  args  command line arguments for client.
     */
    public ClientRunner(final String[] args) {
        this.args = args;
    }

    public void run() {

        LOG.info("run: entry");

        final ProcessTimer processTimer = new ProcessTimer();

        int status = EXIT_SUCCESS;
        try {
            runClient(args);
            LOG.info("run: exit, processing completed in {}", processTimer);
        } catch (final AstrometryException e) {
            LOG.error("run: solve failed", e);
            LOG.info("run: exit, no solution found after {}", processTimer);
            status = EXIT_UNSOLVED;
        } catch (final Throwable t) {
            LOG.error("run: caught exception", t);
            LOG.info("run: exit, processing failed after {}", processTimer);
            status = EXIT_FAILURE;
        }

        System.exit(status);
    }

    /**
     * @param  args  command line arguments for client.
     *
     * @throws AstrometryException
     *   if the image cannot be solved.
     * @throws Exception
     *   if the client fails for any other reason.
     */
    public abstract void runClient(final String[] args) throws Exception;

    private static final Logger LOG = LoggerFactory.getLogger(ClientRunner.class);
}
