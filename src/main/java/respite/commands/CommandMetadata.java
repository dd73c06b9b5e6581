package respite.commands;

public class CommandMetadata {
    private final int arity;

    /**
     * @param arity Redis convention: positive means exactly that many arguments including the
     *              name, negative means at least {@code -arity}
     */
    public CommandMetadata(int arity) {
        this.arity = arity;
    }

    public boolean acceptsArgCount(int argc) {
        return arity >= 0 ? argc == arity : argc >= -arity;
    }

    public int getArity() {
        return arity;
    }
}
