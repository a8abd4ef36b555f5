package io.warden;

import io.warden.cli.WardenCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new WardenCommand()).execute(args);
        System.exit(code);
    }
}
