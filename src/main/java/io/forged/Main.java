package io.forged;

import io.forged.cli.ForgedEventsCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new ForgedEventsCommand()).execute(args);
        System.exit(code);
    }
}
