package com.example.clihelp.util;

import com.example.clihelp.help.HelpLayout;
import com.example.clihelp.model.Arg;
import com.example.clihelp.model.Command;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads command definitions from YAML.
 * <pre>
 * name: fetch
 * description: Download files
 * subcommand_required: false
 * layout:
 *   signature_width: 50
 * args:
 *   - name: URL
 *     required: true
 *     multiple: true
 * options:
 *   - name: time
 *     short: t
 *     long: time
 *     value: SECS
 *     description: Seconds to wait
 *     values: [1, 5, 10]
 * commands:
 *   - name: resume
 *     description: Resume a download
 * </pre>
 */
public class CommandLoader {

    private static final Logger logger = LoggerFactory.getLogger(CommandLoader.class);

    public static CommandFile loadResource(String resource) {
        String name = resource.startsWith("/") ? resource : "/" + resource;
        try (InputStream in = CommandLoader.class.getResourceAsStream(name)) {
            if (in == null) {
                throw new CommandDefinitionException("", "Resource not found: " + resource);
            }
            CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT);
            try (BufferedReader br = new BufferedReader(new InputStreamReader(in, decoder))) {
                return load(br);
            }
        } catch (IOException e) {
            throw new CommandDefinitionException("", "Failed to read resource " + resource, e);
        }
    }

    public static CommandFile loadFile(Path file) {
        try (BufferedReader br = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return load(br);
        } catch (IOException e) {
            throw new CommandDefinitionException("", "Failed to read " + file, e);
        }
    }

    public static CommandFile load(Reader reader) {
        Object root;
        try {
            root = new Yaml().load(reader);
        } catch (YAMLException e) {
            throw new CommandDefinitionException("", "Invalid YAML: " + e.getMessage(), e);
        }
        Map<String, Object> top = asMap(root, "");
        Command command = parseCommand(top, "");
        HelpLayout layout = parseLayout(top.get("layout"), "layout");
        logger.debug("Loaded command '{}' with layout {}", command.getName(), layout);
        return new CommandFile(command, layout);
    }

    private static Command parseCommand(Map<String, Object> m, String path) {
        String name = requireString(m, "name", path);
        Command.Builder builder = Command.builder(name)
                .description(optionalString(m, "description", path))
                .subcommandRequired(optionalBoolean(m, "subcommand_required", path));

        List<Object> args = optionalList(m, "args", path);
        for (int i = 0; i < args.size(); i++) {
            String argPath = child(path, "args[" + i + "]");
            builder.addArg(parseArg(asMap(args.get(i), argPath), argPath));
        }

        List<Object> options = optionalList(m, "options", path);
        for (int i = 0; i < options.size(); i++) {
            String optionPath = child(path, "options[" + i + "]");
            Arg option = parseOption(asMap(options.get(i), optionPath), optionPath);
            try {
                builder.addOption(option);
            } catch (IllegalArgumentException e) {
                throw new CommandDefinitionException(optionPath, e.getMessage(), e);
            }
        }

        List<Object> commands = optionalList(m, "commands", path);
        for (int i = 0; i < commands.size(); i++) {
            String commandPath = child(path, "commands[" + i + "]");
            Command subcommand = parseCommand(asMap(commands.get(i), commandPath), commandPath);
            try {
                builder.addSubcommand(subcommand);
            } catch (IllegalArgumentException e) {
                throw new CommandDefinitionException(commandPath, e.getMessage(), e);
            }
        }

        Command command = builder.build();
        logger.debug("Parsed {}", command);
        return command;
    }

    private static Arg parseArg(Map<String, Object> m, String path) {
        Arg.Builder b = Arg.builder(requireString(m, "name", path))
                .description(optionalString(m, "description", path))
                .takesValue();
        if (optionalBoolean(m, "required", path)) b.required();
        if (optionalBoolean(m, "multiple", path)) b.takesMultipleValues();
        return b.build();
    }

    private static Arg parseOption(Map<String, Object> m, String path) {
        String name = requireString(m, "name", path);
        Arg.Builder b = Arg.builder(name)
                .description(optionalString(m, "description", path))
                .valuePlaceholder(optionalString(m, "value", path));

        String shortName = optionalString(m, "short", path);
        if (shortName != null) {
            if (shortName.length() != 1 || Character.isWhitespace(shortName.charAt(0))) {
                throw new CommandDefinitionException(child(path, "short"), "expected a single character but got '" + shortName + "'");
            }
            b.shortName(shortName.charAt(0));
        }
        String longName = optionalString(m, "long", path);
        if (longName == null && shortName == null) {
            longName = name;
        }
        try {
            b.longName(longName);
        } catch (IllegalArgumentException e) {
            throw new CommandDefinitionException(child(path, "long"), e.getMessage(), e);
        }

        if (m.containsKey("values")) {
            List<Object> raw = optionalList(m, "values", path);
            if (raw.isEmpty()) {
                throw new CommandDefinitionException(child(path, "values"), "must not be empty");
            }
            List<String> values = new ArrayList<>();
            for (int i = 0; i < raw.size(); i++) {
                values.add(scalarText(raw.get(i), child(path, "values[" + i + "]")));
            }
            b.validValues(values);
        }
        if (optionalBoolean(m, "multiple", path)) b.takesMultipleValues();
        if (optionalBoolean(m, "required", path)) b.required();
        return b.build();
    }

    private static HelpLayout parseLayout(Object raw, String path) {
        if (raw == null) return HelpLayout.DEFAULT;
        Map<String, Object> m = asMap(raw, path);
        try {
            return new HelpLayout(
                    optionalInt(m, "signature_width", path, HelpLayout.DEFAULT_SIGNATURE_WIDTH),
                    optionalInt(m, "description_width", path, HelpLayout.DEFAULT_DESCRIPTION_WIDTH),
                    optionalInt(m, "indent", path, HelpLayout.DEFAULT_INDENT),
                    optionalInt(m, "values_indent", path, HelpLayout.DEFAULT_VALUES_INDENT));
        } catch (IllegalArgumentException e) {
            throw new CommandDefinitionException(path, e.getMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object o, String path) {
        if (!(o instanceof Map)) {
            throw new CommandDefinitionException(path, "expected a mapping but got " + describe(o));
        }
        return (Map<String, Object>) o;
    }

    private static String requireString(Map<String, Object> m, String key, String path) {
        String s = optionalString(m, key, path);
        if (s == null || s.isBlank()) {
            throw new CommandDefinitionException(child(path, key), "is required");
        }
        return s;
    }

    private static String optionalString(Map<String, Object> m, String key, String path) {
        Object v = m.get(key);
        if (v == null) return null;
        return scalarText(v, child(path, key));
    }

    // yes/no/on/off resolve to Boolean; quote them to use them as text
    private static String scalarText(Object v, String path) {
        if (v == null || v instanceof Map || v instanceof List || v instanceof Boolean) {
            throw new CommandDefinitionException(path, "expected text but got " + describe(v));
        }
        return v.toString();
    }

    private static boolean optionalBoolean(Map<String, Object> m, String key, String path) {
        Object v = m.get(key);
        if (v == null) return false;
        if (!(v instanceof Boolean)) {
            throw new CommandDefinitionException(child(path, key), "expected true or false but got " + describe(v));
        }
        return (Boolean) v;
    }

    private static int optionalInt(Map<String, Object> m, String key, String path, int defaultValue) {
        Object v = m.get(key);
        if (v == null) return defaultValue;
        if (!(v instanceof Integer)) {
            throw new CommandDefinitionException(child(path, key), "expected an integer but got " + describe(v));
        }
        return (Integer) v;
    }

    @SuppressWarnings("unchecked")
    private static List<Object> optionalList(Map<String, Object> m, String key, String path) {
        Object v = m.get(key);
        if (v == null) return List.of();
        if (!(v instanceof List)) {
            throw new CommandDefinitionException(child(path, key), "expected a list but got " + describe(v));
        }
        return (List<Object>) v;
    }

    private static String child(String path, String key) {
        return path.isEmpty() ? key : path + "." + key;
    }

    private static String describe(Object o) {
        return o == null ? "nothing" : o.getClass().getSimpleName() + " '" + o + "'";
    }
}
