package org.janelia.astrometry.client.parameter;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.Serializable;

import org.janelia.astrometry.json.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for client parameters, adds help support and JSON formatted logging of parsed values.
 *
 * Subclasses are expected to be nested in the client class they configure
 * so that usage text can name the client's main class.
 */
@Parameters
public class CommandLineParameters
        implements Serializable {

    @Parameter(
            names = "--help",
            description = "Display this note",
            help = true)
    public transient boolean help = false;

    /**
     * Parses the arguments for this instance's enclosing client class,
     * exiting the process if help is requested or the arguments are invalid.
     */
    public void parse(final String[] args) {
        parse(args, getClass().getEnclosingClass(), true);
    }

    /**
     * @param  args                 command line arguments.
     * @param  clientClass          class to name in usage text.
     * @param  exitOnHelpOrFailure  exit the process (status 1) after printing usage.
     *
     * @return true if the arguments were parsed and help was not requested.
     */
    public boolean parse(final String[] args,
                         final Class<?> clientClass,
                         final boolean exitOnHelpOrFailure) {

        final JCommander jCommander = new JCommander(this);
        jCommander.setProgramName("java -cp astrometry-java-client.jar " +
                                  (clientClass == null ? getClass().getName() : clientClass.getName()));

        boolean parsed = false;
        try {
            jCommander.parse(args);
            parsed = true;
        } catch (final ParameterException e) {
            jCommander.getConsole().println("\nERROR: invalid command line arguments\n\n" + e.getMessage());
        }

        if (help || (! parsed)) {
            jCommander.getConsole().println("");
            jCommander.usage();
            if (exitOnHelpOrFailure) {
                System.exit(1);
            }
            return false;
        }

        LOG.debug("parse: parsed {}", this);

        return true;
    }

    @Override
    public String toString() {
        try {
            return JsonUtils.FAST_MAPPER.writeValueAsString(this);
        } catch (final JsonProcessingException e) {
            throw new IllegalArgumentException("failed to format parameters", e);
        }
    }

    /**
     * Prints usage for the specified parameters without exiting (verifies parameter annotations in tests).
     */
    public static void parseHelp(final CommandLineParameters parameters) {
        parameters.parse(new String[] { "--help" },
                         parameters.getClass().getEnclosingClass(),
                         false);
    }

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineParameters.class);
}
