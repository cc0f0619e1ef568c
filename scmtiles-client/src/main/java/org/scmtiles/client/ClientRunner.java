package org.scmtiles.client;

import org.scmtiles.grid.assembly.GridAssemblyException;
import org.scmtiles.grid.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line client wrapper that reports how a grid job ended and sets the process exit status.
 *
 * The exit status is 0 only when the client completes normally (the grid file was written),
 * regardless of how many individual cells failed. Configuration and assembly failures are reported
 * with a single error line; anything else is logged with its stack trace.
 */
public abstract class ClientRunner {

    public static final int SUCCESS_STATUS = 0;
    public static final int FAILURE_STATUS = 1;

    private final String[] args;

    /**
     * @param  args  command line arguments for client.
     */
    public ClientRunner(final String[] args) {
        this.args = args;
    }

    /**
     * Runs the client and exits the JVM with the resulting status.
     * Absence of the standard exit log message indicates that the client was terminated abnormally.
     */
    public void run() {
        System.exit(runAndGetExitStatus());
    }

    /**
     * @return {@link #SUCCESS_STATUS} if the client completed, otherwise {@link #FAILURE_STATUS}.
     */
    int runAndGetExitStatus() {

        LOG.info("runAndGetExitStatus: entry");

        final ProcessTimer processTimer = new ProcessTimer();

        int status = FAILURE_STATUS;
        try {
            runClient(args);
            status = SUCCESS_STATUS;
        } catch (final GridAssemblyException e) {
            LOG.error("runAndGetExitStatus: grid was not produced, {}", describe(e));
            LOG.debug("runAndGetExitStatus: assembly failure details", e);
        } catch (final IllegalArgumentException e) {
            LOG.error("runAndGetExitStatus: invalid job configuration, {}", describe(e));
            LOG.debug("runAndGetExitStatus: configuration failure details", e);
        } catch (final Throwable t) {
            LOG.error("runAndGetExitStatus: caught unexpected exception", t);
        }

        if (status == SUCCESS_STATUS) {
            LOG.info("runAndGetExitStatus: exit, grid job completed in {}", processTimer);
        } else {
            LOG.info("runAndGetExitStatus: exit, grid job failed after {}", processTimer);
        }

        return status;
    }

    /**
     * This method should contain the specific client implementation to be wrapped.
     *
     * @param  args  command line arguments for client.
     *
     * @throws Exception
     *   if the client fails for any reason.
     */
    public abstract void runClient(final String[] args) throws Exception;

    private static String describe(final Throwable t) {
        final StringBuilder sb = new StringBuilder(String.valueOf(t.getMessage()));
        for (Throwable cause = t.getCause(); cause != null; cause = cause.getCause()) {
            sb.append(", caused by ").append(cause.getMessage());
        }
        return sb.toString();
    }

    private static final Logger LOG = LoggerFactory.getLogger(ClientRunner.class);
}
