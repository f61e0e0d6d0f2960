package io.voterelay;

import io.voterelay.cli.VoteRelayCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new VoteRelayCommand()).execute(args);
        System.exit(code);
    }
}
