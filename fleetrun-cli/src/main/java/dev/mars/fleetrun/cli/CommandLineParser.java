/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.fleetrun.cli;

import dev.mars.fleetrun.core.ConfigurationError;
import dev.mars.fleetrun.core.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns raw arguments into {@link CommandLineOptions}.
 *
 * <p>Never throws on bad input. Unknown flags, missing flag values, an unknown action and a
 * non-integer concurrency are reported in the returned {@link ParseResult}.</p>
 *
 * <pre>
 * fleetrun [OPTIONS] [FILTERS] ACTION [CONCURRENCY]
 * </pre>
 */
public class CommandLineParser {

    private static final Logger logger = LoggerFactory.getLogger(CommandLineParser.class);

    public ParseResult parse(String[] args) {
        CommandLineOptions.Builder options = CommandLineOptions.builder();
        ValidationResult result = new ValidationResult();
        List<String> positional = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String flag = arg;
            String inlineValue = null;
            if (arg.startsWith("--") && arg.contains("=")) {
                flag = arg.substring(0, arg.indexOf('='));
                inlineValue = arg.substring(arg.indexOf('=') + 1);
            }

            switch (flag) {
                case "--force":
                    options.force(true);
                    break;
                case "--noop":
                    options.noop(true);
                    break;
                case "--no-noop":
                    options.noNoop(true);
                    break;
                case "--splay":
                    options.splay(true);
                    break;
                case "--no-splay":
                    options.noSplay(true);
                    break;
                case "--json":
                    options.json(true);
                    break;
                case "--help":
                case "-h":
                    options.help(true);
                    break;
                case "--server":
                case "--tag":
                case "--environment":
                case "--splaylimit":
                case "--with-identity":
                case "-I":
                case "--with-class":
                case "-C":
                case "--with-fact":
                case "-F":
                case "--select":
                case "-S":
                    String value = inlineValue;
                    if (value == null) {
                        if (i + 1 >= args.length) {
                            result.addError(ConfigurationError.Kind.INVALID_OPTION, flag, "requires a value");
                            break;
                        }
                        value = args[++i];
                    }
                    applyValue(options, result, flag, value);
                    break;
                default:
                    if (arg.startsWith("-") && arg.length() > 1) {
                        result.addError(ConfigurationError.Kind.INVALID_OPTION, arg, "unknown option");
                    } else {
                        positional.add(arg);
                    }
            }
        }

        applyPositional(options, result, positional);

        logger.debug("Parsed {} arguments, {} errors", args.length, result.getErrorCount());
        return new ParseResult(options.build(), result);
    }

    private void applyValue(CommandLineOptions.Builder options, ValidationResult result, String flag, String value) {
        switch (flag) {
            case "--server":
                options.server(value);
                break;
            case "--tag":
                options.tag(value);
                break;
            case "--environment":
                options.environment(value);
                break;
            case "--splaylimit":
                Optional<Integer> seconds = parseInteger(value);
                if (seconds.isPresent()) {
                    options.splaylimit(seconds.get());
                } else {
                    result.addError(ConfigurationError.Kind.INVALID_OPTION, flag, "must be an integer, got '" + value + "'");
                }
                break;
            case "--with-identity":
            case "-I":
                options.withIdentity(value);
                break;
            case "--with-class":
            case "-C":
                options.withClass(value);
                break;
            case "--with-fact":
            case "-F":
                options.withFact(value);
                break;
            case "--select":
            case "-S":
                options.select(value);
                break;
            default:
                throw new IllegalArgumentException("Not a value option: " + flag);
        }
    }

    private void applyPositional(CommandLineOptions.Builder options, ValidationResult result, List<String> positional) {
        if (positional.isEmpty()) {
            return;
        }

        String name = positional.get(0);
        Optional<Action> action = Action.fromCommandName(name);
        if (action.isEmpty()) {
            result.addError(ConfigurationError.Kind.UNKNOWN_ACTION, Action.commandNames());
            return;
        }
        options.action(action.get());

        if (positional.size() > 1 && action.get().takesConcurrency()) {
            String limit = positional.get(1);
            Optional<Integer> concurrency = parseInteger(limit);
            if (concurrency.isPresent()) {
                options.concurrency(concurrency.get());
            } else {
                result.addError(ConfigurationError.Kind.INVALID_CONCURRENCY, limit);
            }
        }
        for (int i = action.get().takesConcurrency() ? 2 : 1; i < positional.size(); i++) {
            result.addError(ConfigurationError.Kind.INVALID_OPTION, positional.get(i), "unexpected argument");
        }
    }

    private static Optional<Integer> parseInteger(String value) {
        try {
            return Optional.of(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Options plus any errors found while reading them.
     */
    public static final class ParseResult {

        private final CommandLineOptions options;
        private final ValidationResult validation;

        ParseResult(CommandLineOptions options, ValidationResult validation) {
            this.options = options;
            this.validation = validation;
        }

        public CommandLineOptions getOptions() {
            return options;
        }

        public ValidationResult getValidation() {
            return validation;
        }

        public boolean isValid() {
            return validation.isValid();
        }
    }
}
