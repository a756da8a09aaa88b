package com.example.clihelp.help;

import com.example.clihelp.model.Arg;
import com.example.clihelp.model.Command;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * Writes the help text of a command: description, usage, positional args,
 * subcommands, options and footer, in that order.
 * <p>
 * Output is buffered and flushed once at the end of {@link #write()}.
 */
public class HelpWriter {

    private static final Logger logger = LoggerFactory.getLogger(HelpWriter.class);

    private static final int BUFFER_SIZE = 4096;

    /** Appended to every non-empty option list. */
    public static final Arg HELP_OPTION = Arg.booleanOption("help", 'h', "Print this help and exit");

    private final Command command;
    private final OutputStream out;
    private final HelpLayout layout;

    /** Writes to standard error. */
    public HelpWriter(Command command) {
        this(command, System.err, HelpLayout.DEFAULT);
    }

    public HelpWriter(Command command, OutputStream sink) {
        this(command, sink, HelpLayout.DEFAULT);
    }

    public HelpWriter(Command command, OutputStream sink, HelpLayout layout) {
        this.command = Objects.requireNonNull(command, "Command must not be null");
        Objects.requireNonNull(sink, "Sink must not be null");
        this.layout = Objects.requireNonNull(layout, "Layout must not be null");
        this.out = new BufferedOutputStream(sink, BUFFER_SIZE);
    }

    /**
     * Renders the help text of {@code command} with the default layout.
     */
    public static String render(Command command) {
        return render(command, HelpLayout.DEFAULT);
    }

    public static String render(Command command, HelpLayout layout) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try {
            new HelpWriter(command, buffer, layout).write();
        } catch (IOException e) {
            // not thrown by ByteArrayOutputStream
            throw new UncheckedIOException(e);
        }
        logger.debug("Rendered help for '{}' ({} bytes)", command.getName(), buffer.size());
        return buffer.toString(StandardCharsets.UTF_8);
    }

    /**
     * Writes the complete help text and flushes the sink.
     *
     * @throws IOException            if the sink rejects a write
     * @throws BlockOverflowException if a name or description is too long for its column
     */
    public void write() throws IOException {
        logger.debug("Writing help for command '{}'", command.getName());
        writeDescription();
        writeHeader();
        writePositionalArgs();
        writeSubcommands();
        writeOptions();
        writeFooter();

        out.flush();
    }

    private void writeDescription() throws IOException {
        if (command.getDescription() != null) {
            writeText(command.getDescription() + "\n\n");
        }
    }

    private void writeHeader() throws IOException {
        StringBuilder sb = new StringBuilder("Usage: ").append(command.getName());

        if (command.countPositionalArgs() >= 1) {
            sb.append(' ').append(enclose("ARGS", command.hasProperty(Command.Property.POSITIONAL_ARG_REQUIRED)));
        }
        if (command.countOptions() >= 1) {
            sb.append(" [OPTIONS]");
        }
        if (command.countSubcommands() >= 1) {
            sb.append(' ').append(enclose("COMMAND", command.hasProperty(Command.Property.SUBCOMMAND_REQUIRED)));
        }

        sb.append('\n');
        writeText(sb.toString());
    }

    private void writePositionalArgs() throws IOException {
        if (command.countPositionalArgs() == 0) {
            return;
        }

        writeText("\nArgs:\n");
        for (Arg arg : command.getPositionalArgs()) {
            Line line = new Line(layout);
            line.signature().appendPadding(layout.getIndent());
            line.signature().append(arg.getName());
            if (arg.hasProperty(Arg.Property.TAKES_MULTIPLE_VALUES)) {
                line.signature().append("...");
            }
            if (arg.getDescription() != null) {
                line.description().append(arg.getDescription());
            }
            line.format(out);
        }
    }

    private void writeSubcommands() throws IOException {
        if (command.countSubcommands() == 0) {
            return;
        }

        writeText("\nCommands:\n");
        for (Command subcommand : command.getSubcommands()) {
            Line line = new Line(layout);
            line.signature().appendPadding(layout.getIndent());
            line.signature().append(subcommand.getName());
            if (subcommand.getDescription() != null) {
                line.description().append(subcommand.getDescription());
            }
            line.format(out);
        }
    }

    private void writeOptions() throws IOException {
        if (command.countOptions() == 0) {
            return;
        }

        writeText("\nOptions:\n");
        for (Arg option : command.getOptions()) {
            writeOption(option);
        }
        writeOption(HELP_OPTION);
    }

    /**
     * An option without description and valid values produces no row.
     */
    private void writeOption(Arg option) throws IOException {
        Line line = new Line(layout);
        ContentBlock signature = line.signature();
        signature.appendPadding(layout.getIndent());

        Character shortName = option.getShortName();
        String longName = option.getLongName();
        signature.appendPadding(longNamePadding(shortName != null, longName != null, layout));
        if (shortName != null && longName != null) {
            signature.append("-" + shortName + ", --" + longName);
        } else if (shortName != null) {
            signature.append("-" + shortName);
        } else if (longName != null) {
            signature.append("--" + longName);
        }

        if (option.hasProperty(Arg.Property.TAKES_VALUE)) {
            String valueName = option.getValuePlaceholder() != null ? option.getValuePlaceholder() : option.getName();
            signature.append("=<" + valueName + ">");
            if (option.hasProperty(Arg.Property.TAKES_MULTIPLE_VALUES)) {
                signature.append("...");
            }
        }

        if (option.getDescription() != null) {
            line.description().append(option.getDescription());
            line.format(out);
        }

        List<String> validValues = option.getValidValues();
        if (validValues != null) {
            if (option.getDescription() == null) {
                line.description().append(formatValues(validValues));
                line.format(out);
                return;
            }

            Line valuesLine = new Line(layout);
            valuesLine.description().appendPadding(layout.getValuesIndent());
            valuesLine.description().append(formatValues(validValues));
            valuesLine.format(out);
        }
    }

    private void writeFooter() throws IOException {
        if (command.countSubcommands() >= 1) {
            writeText("\nRun '" + command.getName() + " <command>' with '-h/--help' flag to get help of any command.\n");
        }
    }

    private void writeText(String text) throws IOException {
        out.write(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * {@code <LABEL>} when required, {@code [LABEL]} otherwise.
     */
    public static String enclose(String label, boolean required) {
        return required ? "<" + label + ">" : "[" + label + "]";
    }

    /**
     * Extra spaces before an option name. Options with only a long name are
     * shifted so their long name lines up under the long name of options that
     * have both:
     * <pre>
     *     -t, --time
     *         --max-time
     * </pre>
     */
    public static int longNamePadding(boolean hasShortName, boolean hasLongName, HelpLayout layout) {
        return !hasShortName && hasLongName ? layout.getIndent() : 0;
    }

    public static String formatValues(List<String> values) {
        return "values: { " + String.join(", ", values) + " }";
    }
}
