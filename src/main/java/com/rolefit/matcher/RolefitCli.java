package com.rolefit.matcher;

import ch.qos.logback.classic.Level;
import com.rolefit.matcher.command.RankCommand;
import com.rolefit.matcher.command.ScoreCommand;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

@Command(
    name = "rolefit",
    mixinStandardHelpOptions = true,
    version = "rolefit 1.0.0",
    description = "Hybrid semantic and keyword matching of candidate documents against a target role",
    subcommands = {
        ScoreCommand.class,
        RankCommand.class
    }
)
public class RolefitCli implements Callable<Integer> {

    static final String BASE_LOGGER = "com.rolefit";

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose logging")
    boolean verbose;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new RolefitCli())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Raise the application logger to DEBUG when {@code --verbose} was given.
     */
    public void applyLogLevel() {
        if (verbose && LoggerFactory.getLogger(BASE_LOGGER) instanceof ch.qos.logback.classic.Logger logger) {
            logger.setLevel(Level.DEBUG);
        }
    }
}
