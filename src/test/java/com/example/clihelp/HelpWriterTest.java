package com.example.clihelp;

import com.example.clihelp.help.BlockOverflowException;
import com.example.clihelp.help.HelpLayout;
import com.example.clihelp.help.HelpWriter;
import com.example.clihelp.model.Arg;
import com.example.clihelp.model.Command;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("HelpWriter Tests")
public class HelpWriterTest {

    private static final String HELP_ROW = pad("    -h, --help") + "Print this help and exit\n";

    private static String pad(String signature) {
        return String.format("%-50s", signature);
    }

    private static Command fetchCommand() {
        return Command.builder("fetch")
                .description("Download files")
                .addArg(Arg.builder("URL").description("Addresses to download").takesMultipleValues().required().build())
                .addOption(Arg.builder("time").shortName('t').longName("time").valuePlaceholder("SECS")
                        .description("Seconds to wait").build())
                .addSubcommand(Command.builder("resume").description("Resume a download").build())
                .build();
    }

    @Test
    @DisplayName("Complete command renders every section in order")
    void rendersAllSections() {
        String expected = "Download files\n\n" +
                "Usage: fetch <ARGS> [OPTIONS] [COMMAND]\n" +
                "\nArgs:\n" +
                pad("    URL...") + "Addresses to download\n" +
                "\nCommands:\n" +
                pad("    resume") + "Resume a download\n" +
                "\nOptions:\n" +
                pad("    -t, --time=<SECS>") + "Seconds to wait\n" +
                HELP_ROW +
                "\nRun 'fetch <command>' with '-h/--help' flag to get help of any command.\n";

        assertEquals(expected, HelpWriter.render(fetchCommand()));
    }

    @Test
    @DisplayName("Single required positional arg gives angle brackets and an Args section")
    void requiredPositionalArg() {
        Command cmd = Command.builder("mycmd")
                .addArg(Arg.builder("FILE").takesValue().required().build())
                .build();

        String help = HelpWriter.render(cmd);
        assertTrue(help.startsWith("Usage: mycmd <ARGS>\n"), help);
        assertEquals("Usage: mycmd <ARGS>\n\nArgs:\n" + pad("    FILE") + "\n", help);
    }

    @Test
    @DisplayName("Optional positional args and required subcommand pick their own brackets")
    void bracketsFollowEachFlag() {
        Command cmd = Command.builder("tool")
                .addArg(Arg.positional("PATH", null, false))
                .addSubcommand(Command.builder("run").build())
                .subcommandRequired(true)
                .build();

        assertTrue(HelpWriter.render(cmd).startsWith("Usage: tool [ARGS] <COMMAND>\n"));
    }

    @Test
    @DisplayName("Bare command prints only the usage line")
    void bareCommand() {
        assertEquals("Usage: bare\n", HelpWriter.render(Command.builder("bare").build()));
    }

    @Test
    @DisplayName("Positional args without description still get a row")
    void positionalWithoutDescription() {
        Command cmd = Command.builder("cp")
                .addArg(Arg.positional("SRC", null, true))
                .addArg(Arg.positional("DEST", "Target directory", false))
                .build();

        assertEquals("Usage: cp [ARGS]\n\nArgs:\n" +
                pad("    SRC...") + "\n" +
                pad("    DEST") + "Target directory\n", HelpWriter.render(cmd));
    }

    @Test
    @DisplayName("Long-only option names line up with long names of options that have both")
    void longOnlyOptionAlignment() {
        Command cmd = Command.builder("wait")
                .addOption(Arg.booleanOption("time", 't', "Time"))
                .addOption(Arg.builder("max-time").longName("max-time").description("Maximum time").build())
                .build();

        String help = HelpWriter.render(cmd);
        assertEquals("Usage: wait [OPTIONS]\n\nOptions:\n" +
                pad("    -t, --time") + "Time\n" +
                pad("        --max-time") + "Maximum time\n" +
                HELP_ROW, help);

        String[] rows = help.split("\n");
        assertEquals(8, rows[3].indexOf("--time"));
        assertEquals(8, rows[4].indexOf("--max-time"));
    }

    @Test
    @DisplayName("Short-only option prints only the short name")
    void shortOnlyOption() {
        Command cmd = Command.builder("ls")
                .addOption(Arg.builder("verbose").shortName('v').description("Verbose output").build())
                .build();

        assertTrue(HelpWriter.render(cmd).contains(pad("    -v") + "Verbose output\n"));
    }

    @Test
    @DisplayName("Value placeholder falls back to the option name and marks multiple values")
    void valuePlaceholders() {
        Command cmd = Command.builder("tar")
                .addOption(Arg.multiValuesOption("file", 'f', "Files to add"))
                .addOption(Arg.builder("level").shortName('l').longName("level").valuePlaceholder("N")
                        .description("Compression level").build())
                .build();

        String help = HelpWriter.render(cmd);
        assertTrue(help.contains(pad("    -f, --file=<file>...") + "Files to add\n"), help);
        assertTrue(help.contains(pad("    -l, --level=<N>") + "Compression level\n"), help);
    }

    @Test
    @DisplayName("Description longer than its column continues on one extra row")
    void descriptionOverflowRow() {
        String description = "d".repeat(500) + "0123456789";
        Command cmd = Command.builder("big")
                .addOption(Arg.booleanOption("long", 'l', description))
                .build();

        String help = HelpWriter.render(cmd);
        assertEquals("Usage: big [OPTIONS]\n\nOptions:\n" +
                pad("    -l, --long") + "d".repeat(500) + "\n" +
                pad("    ") + "0123456789\n" +
                HELP_ROW, help);
    }

    @Test
    @DisplayName("Valid values with a description go on an indented second row")
    void validValuesWithDescription() {
        Command cmd = Command.builder("copy")
                .addOption(Arg.singleValueOptionWithValidValues("mode", 'm', "Transfer mode", List.of("fast", "slow")))
                .build();

        assertEquals("Usage: copy [OPTIONS]\n\nOptions:\n" +
                pad("    -m, --mode=<mode>") + "Transfer mode\n" +
                pad("") + "  values: { fast, slow }\n" +
                HELP_ROW, HelpWriter.render(cmd));
    }

    @Test
    @DisplayName("Valid values without a description share the option row")
    void validValuesWithoutDescription() {
        Command cmd = Command.builder("zip")
                .addOption(Arg.builder("level").shortName('l').validValues(List.of("1", "5", "9")).build())
                .build();

        assertEquals("Usage: zip [OPTIONS]\n\nOptions:\n" +
                pad("    -l=<level>") + "values: { 1, 5, 9 }\n" +
                HELP_ROW, HelpWriter.render(cmd));
    }

    @Test
    @DisplayName("Option with neither description nor valid values produces no row")
    void optionWithoutTextIsSkipped() {
        Command cmd = Command.builder("quiet")
                .addOption(Arg.builder("silent").shortName('s').longName("silent").build())
                .build();

        assertEquals("Usage: quiet [OPTIONS]\n\nOptions:\n" + HELP_ROW, HelpWriter.render(cmd));
    }

    @Test
    @DisplayName("Footer is written only when there are subcommands")
    void footerOnlyWithSubcommands() {
        String withSubcommands = HelpWriter.render(fetchCommand());
        assertTrue(withSubcommands.endsWith("\nRun 'fetch <command>' with '-h/--help' flag to get help of any command.\n"));

        Command leaf = Command.builder("leaf").addOption(Arg.booleanOption("all", 'a', "All")).build();
        assertFalse(HelpWriter.render(leaf).contains("Run '"));
    }

    @Test
    @DisplayName("Rendering the same command twice gives identical output")
    void renderingIsIdempotent() throws IOException {
        Command cmd = fetchCommand();
        ByteArrayOutputStream first = new ByteArrayOutputStream();
        ByteArrayOutputStream second = new ByteArrayOutputStream();
        new HelpWriter(cmd, first).write();
        new HelpWriter(cmd, second).write();

        assertArrayEquals(first.toByteArray(), second.toByteArray());
        assertEquals(HelpWriter.render(cmd), HelpWriter.render(cmd));
    }

    @Test
    @DisplayName("Sink failures propagate to the caller")
    void sinkFailurePropagates() {
        OutputStream broken = new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                throw new IOException("Broken pipe");
            }

            @Override
            public void write(byte[] b, int off, int len) throws IOException {
                throw new IOException("Broken pipe");
            }
        };

        IOException e = assertThrows(IOException.class, () -> new HelpWriter(fetchCommand(), broken).write());
        assertEquals("Broken pipe", e.getMessage());
    }

    @Test
    @DisplayName("Output reaches the sink only once the render is complete")
    void flushedOnceAtEnd() throws IOException {
        int[] writes = {0};
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        OutputStream counting = new OutputStream() {
            @Override
            public void write(int b) {
                writes[0]++;
                captured.write(b);
            }

            @Override
            public void write(byte[] b, int off, int len) {
                writes[0]++;
                captured.write(b, off, len);
            }
        };

        new HelpWriter(fetchCommand(), counting).write();
        assertEquals(1, writes[0]);
        assertEquals(HelpWriter.render(fetchCommand()), captured.toString(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Names too long for a signature and its overflow row fail the render")
    void capacityViolationPropagates() {
        Command cmd = Command.builder("huge")
                .addArg(Arg.positional("a".repeat(97), null, false))
                .build();

        assertThrows(BlockOverflowException.class, () -> HelpWriter.render(cmd));
    }

    @Test
    @DisplayName("Custom layout changes column widths and indents")
    void customLayout() {
        HelpLayout layout = new HelpLayout(12, 16, 2, 1);
        Command cmd = Command.builder("tool")
                .addOption(Arg.builder("output").shortName('o').valuePlaceholder("FILE")
                        .description("Where to write the result").build())
                .build();

        assertEquals("Usage: tool [OPTIONS]\n\nOptions:\n" +
                "  -o=<FILE> Where to write t\n" +
                "            he result\n" +
                "  -h, --helpPrint this help \n" +
                "            and exit\n", HelpWriter.render(cmd, layout));
    }

    @ParameterizedTest
    @CsvSource({
        "ARGS, true, <ARGS>",
        "ARGS, false, [ARGS]",
        "COMMAND, true, <COMMAND>",
        "COMMAND, false, [COMMAND]"
    })
    @DisplayName("Required groups use angle brackets, optional ones square brackets")
    void enclose(String label, boolean required, String expected) {
        assertEquals(expected, HelpWriter.enclose(label, required));
    }

    @ParameterizedTest
    @CsvSource({
        "true, true, 0",
        "true, false, 0",
        "false, true, 4",
        "false, false, 0"
    })
    @DisplayName("Only long-only options get the extra indent")
    void longNamePadding(boolean hasShort, boolean hasLong, int expected) {
        assertEquals(expected, HelpWriter.longNamePadding(hasShort, hasLong, HelpLayout.DEFAULT));
    }
}
