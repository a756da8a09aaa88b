package com.example.clihelp.tools;

import com.example.clihelp.help.BlockOverflowException;
import com.example.clihelp.help.HelpWriter;
import com.example.clihelp.model.Command;
import com.example.clihelp.util.CommandDefinitionException;
import com.example.clihelp.util.CommandFile;
import com.example.clihelp.util.CommandLoader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Paths;

/**
 * Prints the help text of a command described in YAML.
 * <p>
 * Usage: {@code PrintHelp <file.yaml | classpath:resource.yaml> [subcommand...]}
 */
public class PrintHelp {
    private static final Logger logger = LoggerFactory.getLogger(PrintHelp.class);

    private static final String CLASSPATH_PREFIX = "classpath:";

    public static void main(String[] args) {
        if (args.length == 0) {
            System.err.println("Usage: PrintHelp <file.yaml | classpath:resource.yaml> [subcommand...]");
            return;
        }
        try {
            print(args, System.err);
        } catch (CommandDefinitionException | IllegalArgumentException | BlockOverflowException e) {
            logger.error("Cannot print help for {}: {}", args[0], e.getMessage());
            System.err.println("error: " + e.getMessage());
        } catch (IOException e) {
            logger.error("Failed to write help text: {}", e.getMessage(), e);
        }
    }

    /**
     * Loads {@code args[0]}, walks down the subcommands named by the remaining
     * args and writes the help text of the command reached to {@code sink}.
     *
     * @throws IllegalArgumentException if a named subcommand does not exist
     */
    public static void print(String[] args, OutputStream sink) throws IOException {
        String source = args[0];
        CommandFile file = source.startsWith(CLASSPATH_PREFIX)
                ? CommandLoader.loadResource(source.substring(CLASSPATH_PREFIX.length()))
                : CommandLoader.loadFile(Paths.get(source));

        Command command = file.getCommand();
        for (int i = 1; i < args.length; i++) {
            Command next = command.findSubcommand(args[i]);
            if (next == null) {
                throw new IllegalArgumentException("'" + command.getName() + "' has no subcommand '" + args[i] + "'");
            }
            command = next;
        }

        logger.debug("Printing help for '{}' from {}", command.getName(), source);
        new HelpWriter(command, sink, file.getLayout()).write();
    }
}
