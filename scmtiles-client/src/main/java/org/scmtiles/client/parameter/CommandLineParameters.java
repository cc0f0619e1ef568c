package org.scmtiles.client.parameter;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;

import java.io.Serializable;

import org.scmtiles.grid.json.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base parameters for the grid job clients.
 *
 * Arguments are checked in two steps: JCommander syntax first, then {@link #validate()} for value
 * constraints JCommander can not express (e.g. positive worker counts).
 * A failure in either step prints the error followed by usage.
 */
@Parameters
public class CommandLineParameters implements Serializable {

    public static final String STANDALONE_JAR = "scmtiles-client-standalone.jar";

    @Parameter(
            names = "--help",
            description = "Display this note",
            help = true)
    public transient boolean help;

    private transient JCommander jCommander;

    public CommandLineParameters() {
        this.help = false;
        this.jCommander = null;
    }

    /**
     * Parses arguments for the client class enclosing this parameters class,
     * exiting with status 1 after printing usage if help was requested or the arguments are invalid.
     */
    public void parse(final String[] args) {
        parse(args, this.getClass().getEnclosingClass(), true);
    }

    /**
     * @return true if the arguments were parsed and validated and help was not requested.
     */
    public boolean parse(final String[] args,
                         final Class programClass,
                         final boolean exitOnHelpOrFailure) {

        final String clientName = programClass == null ? getClass().getName() : programClass.getName();

        jCommander = new JCommander(this);
        jCommander.setProgramName("java -cp " + STANDALONE_JAR + " " + clientName);

        final String error = parseAndValidate(args);

        final boolean usable = (error == null) && (! help);
        if (! usable) {
            if (error != null) {
                System.err.println("\nERROR: " + error);
            }
            System.err.println();
            jCommander.usage();
            if (exitOnHelpOrFailure) {
                System.exit(1);
            }
        }

        return usable;
    }

    /**
     * Checks value constraints after a successful parse.
     * The default implementation accepts everything.
     *
     * @throws IllegalArgumentException
     *   if any parsed value is invalid.
     */
    public void validate()
            throws IllegalArgumentException {
    }

    /**
     * @return string representation of these parameters.
     */
    @Override
    public String toString() {
        return JsonUtils.toJson(this);
    }

    private String parseAndValidate(final String[] args) {
        String error = null;
        try {
            jCommander.parse(args);
            if (! help) {
                validate();
            }
        } catch (final ParameterException pe) {
            error = "failed to parse command line arguments\n\n" + pe.getMessage();
        } catch (final IllegalArgumentException iae) {
            error = "invalid command line arguments\n\n" + iae.getMessage();
        } catch (final Throwable t) {
            LOG.error("parseAndValidate: failed to parse command line arguments", t);
            error = "failed to parse command line arguments, see log for details";
        }
        return error;
    }

    /**
     * Helper (no pun intended) for testing parameter parsing.
     *
     * @param  parameters  parameters instance to test.
     */
    public static void parseHelp(final CommandLineParameters parameters) {
        parameters.parse(new String[] { "--help" },
                         parameters.getClass().getEnclosingClass(),
                         false);
    }

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineParameters.class);

}
