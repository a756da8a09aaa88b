package com.example.clihelp.util;

import com.example.clihelp.help.HelpLayout;
import com.example.clihelp.model.Command;

/**
 * A command tree read from YAML together with the layout to print it with.
 */
public class CommandFile {

    private final Command command;
    private final HelpLayout layout;

    public CommandFile(Command command, HelpLayout layout) {
        this.command = command;
        this.layout = layout;
    }

    public Command getCommand() { return command; }
    public HelpLayout getLayout() { return layout; }
}
