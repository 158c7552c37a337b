package dev.kitchen;

import dev.kitchen.cli.KitchenCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new KitchenCli()).execute(args);
        System.exit(exitCode);
    }
}
