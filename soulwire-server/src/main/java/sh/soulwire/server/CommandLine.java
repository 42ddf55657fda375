// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.server;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import sh.soulwire.core.error.ProtocolException;

/**
 * One parsed command line.
 *
 * <p>
 * Tokens are separated by runs of spaces. As in IRC, a token that starts with
 * {@code :} (other than the verb) swallows the remainder of the line, spaces
 * included, as a single final argument. The verb is upper-cased; arguments keep
 * their case.
 *
 * @param verb the upper-cased command verb
 * @param args the arguments after the verb
 * @param rest the raw text after the verb, with one leading {@code :} removed
 * @since 0.1.0
 */
public record CommandLine(String verb, List<String> args, String rest) {

    public CommandLine {
        Objects.requireNonNull(verb, "verb");
        args = List.copyOf(args);
        Objects.requireNonNull(rest, "rest");
    }

    /**
     * Parses a line without its terminator.
     *
     * @throws ProtocolException if the line is blank
     */
    public static CommandLine parse(final String line) {
        if (line == null || line.isBlank()) {
            throw new ProtocolException("empty line");
        }
        final String trimmed = stripLeadingSpaces(stripTerminator(line));
        final int verbEnd = indexOfSpace(trimmed, 0);
        final String verb = trimmed.substring(0, verbEnd).toUpperCase(Locale.ROOT);

        String rest = stripLeadingSpaces(trimmed.substring(verbEnd));
        final List<String> args = new ArrayList<>();
        int i = 0;
        while (i < rest.length()) {
            if (rest.charAt(i) == ' ') {
                i++;
                continue;
            }
            if (rest.charAt(i) == ':') {
                args.add(rest.substring(i + 1));
                break;
            }
            final int end = indexOfSpace(rest, i);
            args.add(rest.substring(i, end));
            i = end;
        }
        if (rest.startsWith(":")) {
            rest = rest.substring(1);
        }
        return new CommandLine(verb, args, rest);
    }

    public int argCount() {
        return args.size();
    }

    /**
     * Returns argument {@code index}.
     *
     * @throws ProtocolException naming {@code what} if the argument is missing
     */
    public String arg(final int index, final String what) {
        if (index >= args.size()) {
            throw new ProtocolException(verb + ": missing " + what);
        }
        return args.get(index);
    }

    /**
     * Returns the first argument upper-cased, used as a sub-command; empty when there are no arguments.
     */
    public String subcommand() {
        return args.isEmpty() ? "" : args.get(0).toUpperCase(Locale.ROOT);
    }

    private static String stripTerminator(final String line) {
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == '\r' || line.charAt(end - 1) == '\n')) {
            end--;
        }
        return line.substring(0, end);
    }

    private static String stripLeadingSpaces(final String value) {
        int start = 0;
        while (start < value.length() && value.charAt(start) == ' ') {
            start++;
        }
        return value.substring(start);
    }

    private static int indexOfSpace(final String value, final int from) {
        final int idx = value.indexOf(' ', from);
        return idx < 0 ? value.length() : idx;
    }
}
