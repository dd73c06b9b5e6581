package respite.commands;

public class CommandContainer {
    private final String name;
    private final Command command;
    private final CommandMetadata metadata;

    public CommandContainer(String name, Command command, CommandMetadata metadata) {
        this.name = name;
        this.command = command;
        this.metadata = metadata;
    }

    public String getName() {
        return name;
    }

    public Command getCommand() {
        return command;
    }

    public CommandMetadata getMetadata() {
        return metadata;
    }
}
