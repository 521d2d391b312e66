package io.blockchain.datastore.datastore;

/** What a control event asks for, with its command word on the wire. */
public enum SubAction {
    /** Start tracking a namespace, optionally from a timestamp on. */
    START("subscribe"),
    /** Stop tracking a namespace immediately. */
    END("unsubscribe");

    private final String command;

    SubAction(String command) {
        this.command = command;
    }

    public String command() {
        return command;
    }

    static SubAction fromCommand(String command) {
        for (SubAction action : values()) {
            if (action.command.equals(command)) {
                return action;
            }
        }
        return null;
    }
}
