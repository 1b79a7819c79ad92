package io.stationkeeper;

import io.stationkeeper.cli.StationCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new StationCommand()).execute(args);
        System.exit(code);
    }
}
