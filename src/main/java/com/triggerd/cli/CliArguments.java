package com.triggerd.cli;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Parsed command line of one sub-command.
 *
 *   add --name daily --cron "0 9 * * *" --script ./a.py --event-name x --event-name y
 *   show daily
 *
 * Options take a value, either as the next argument or after "=". An option
 * may repeat; {@link #option} returns the last value, {@link #options} all of
 * them. Everything else is positional. "--" ends option parsing.
 */
public class CliArguments {

    private final Map<String, List<String>> options;
    private final List<String> positionals;

    private CliArguments(Map<String, List<String>> options, List<String> positionals) {
        this.options = options;
        this.positionals = positionals;
    }

    public static CliArguments parse(List<String> args) {
        Map<String, List<String>> options = new LinkedHashMap<>();
        List<String> positionals = new ArrayList<>();
        boolean optionsEnded = false;

        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            if (optionsEnded || !arg.startsWith("--")) {
                positionals.add(arg);
                continue;
            }
            if (arg.equals("--")) {
                optionsEnded = true;
                continue;
            }
            String name;
            String value;
            int eq = arg.indexOf('=');
            if (eq > 0) {
                name = arg.substring(2, eq);
                value = arg.substring(eq + 1);
            } else {
                name = arg.substring(2);
                if (i + 1 >= args.size()) {
                    throw new UsageException("Option --" + name + " requires a value");
                }
                value = args.get(++i);
            }
            options.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
        }
        return new CliArguments(options, positionals);
    }

    public Optional<String> option(String name) {
        List<String> values = options.get(name);
        return values == null ? Optional.empty() : Optional.of(values.get(values.size() - 1));
    }

    public String requireOption(String name) {
        return option(name).orElseThrow(() -> new UsageException("Missing option --" + name));
    }

    public List<String> options(String name) {
        return options.getOrDefault(name, Collections.emptyList());
    }

    public Set<String> optionNames() {
        return Collections.unmodifiableSet(options.keySet());
    }

    public List<String> positionals() {
        return Collections.unmodifiableList(positionals);
    }

    public String requirePositional(int index, String label) {
        if (index >= positionals.size()) {
            throw new UsageException("Missing argument <" + label + ">");
        }
        return positionals.get(index);
    }

    public Optional<Integer> intOption(String name) {
        Optional<String> raw = option(name);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(raw.get()));
        } catch (NumberFormatException e) {
            throw new UsageException("Option --" + name + " expects a number, got '" + raw.get() + "'");
        }
    }
}
