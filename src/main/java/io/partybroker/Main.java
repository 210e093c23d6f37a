package io.partybroker;

import io.partybroker.cli.BrokerCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new BrokerCommand()).execute(args);
        System.exit(code);
    }
}
