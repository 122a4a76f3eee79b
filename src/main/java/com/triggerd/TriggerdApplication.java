package com.triggerd;

import com.triggerd.cli.CliArguments;
import com.triggerd.cli.ExitCodes;
import com.triggerd.cli.TriggerdCli;
import com.triggerd.cli.UsageException;
import com.triggerd.daemon.DaemonAlreadyRunningException;
import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Entry point for both the daemon and the one-shot CLI.
 *
 *   triggerd run-foreground [--log-file PATH] [--host HOST] [--port PORT]
 *       → web server + scheduler + PID file, runs until SIGTERM/SIGINT
 *   triggerd &lt;any other command&gt;
 *       → non-web context with the "cli" profile and the scheduler off,
 *         runs the command, exits with its code
 */
@SpringBootApplication
public class TriggerdApplication {

    static final String RUN_FOREGROUND = "run-foreground";

    public static void main(String[] args) {
        if (args.length == 0) {
            System.err.print(TriggerdCli.USAGE);
            System.exit(ExitCodes.USAGE);
        }
        if (RUN_FOREGROUND.equals(args[0])) {
            runForeground(Arrays.asList(args).subList(1, args.length));
            return;
        }
        System.exit(runCommand(args));
    }

    static int runCommand(String[] args) {
        SpringApplication app = new SpringApplication(TriggerdApplication.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.setBannerMode(Banner.Mode.OFF);
        app.setAdditionalProfiles("cli");
        try (ConfigurableApplicationContext context = app.run("--triggerd.scheduler.enabled=false")) {
            return context.getBean(TriggerdCli.class).run(args);
        }
    }

    static void runForeground(List<String> args) {
        String[] properties;
        try {
            properties = foregroundProperties(CliArguments.parse(args));
        } catch (UsageException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(ExitCodes.USAGE);
            return;
        }

        SpringApplication app = new SpringApplication(TriggerdApplication.class);
        app.setWebApplicationType(WebApplicationType.SERVLET);
        try {
            app.run(properties);
        } catch (RuntimeException e) {
            DaemonAlreadyRunningException alreadyRunning = findAlreadyRunning(e);
            if (alreadyRunning != null) {
                System.err.println(alreadyRunning.getMessage());
                System.exit(alreadyRunning.getExitCode());
            }
            throw e;
        }
    }

    /**
     * Turns run-foreground options into Spring property arguments. Options
     * other than the three known ones are passed through as properties.
     */
    static String[] foregroundProperties(CliArguments options) {
        List<String> properties = new ArrayList<>();
        properties.add("--triggerd.scheduler.enabled=true");
        properties.add("--triggerd.daemon.manage-pid-file=true");
        Map<String, String> renamed = Map.of(
                "log-file", "logging.file.name",
                "host", "server.address",
                "port", "server.port");
        if (!options.positionals().isEmpty()) {
            throw new UsageException("Unexpected argument '" + options.positionals().get(0) + "'");
        }
        for (String option : options.optionNames()) {
            String property = renamed.getOrDefault(option, option);
            options.option(option).ifPresent(value -> properties.add("--" + property + "=" + value));
        }
        return properties.toArray(new String[0]);
    }

    private static DaemonAlreadyRunningException findAlreadyRunning(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof DaemonAlreadyRunningException) {
                return (DaemonAlreadyRunningException) t;
            }
        }
        return null;
    }
}
