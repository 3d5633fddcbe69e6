package io.kuberde;

import io.kuberde.cli.KubeRdeCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new KubeRdeCommand()).execute(args);
        System.exit(code);
    }
}
