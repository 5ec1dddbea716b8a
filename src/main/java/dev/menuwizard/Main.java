package dev.menuwizard;

import dev.menuwizard.cli.MenuWizardCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new MenuWizardCli()).execute(args);
        System.exit(exitCode);
    }
}
