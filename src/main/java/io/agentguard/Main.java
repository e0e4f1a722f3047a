package io.agentguard;

import io.agentguard.cli.GuardCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new GuardCommand()).execute(args);
        System.exit(code);
    }
}
