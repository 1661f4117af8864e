package io.flowdetect.circuit;

import io.flowdetect.exceptions.MalformedInstructionException;
import io.flowdetect.pauli.Pauli;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for the subset of the stim text format the engine works on.
 * <p>
 * Supported syntax: one instruction per line as {@code NAME(args) targets},
 * {@code #} comments, and {@code REPEAT n { ... }} blocks that may be nested.
 * Every instruction name must be known to the {@link GateRegistry}.
 */
public final class CircuitParser {

    private static final Pattern INSTRUCTION = Pattern.compile(
            "^([A-Za-z_][A-Za-z0-9_]*)\\s*(?:\\(([^)]*)\\))?\\s*(.*)$");
    private static final Pattern REPEAT = Pattern.compile("^REPEAT\\s+(\\S+)\\s*\\{$", Pattern.CASE_INSENSITIVE);
    private static final Pattern RECORD = Pattern.compile("^rec\\[(-?\\d+)]$");
    private static final Pattern PAULI_TARGET = Pattern.compile("^(!?)([XYZxyz])(\\d+)$");

    private final String[] lines;
    private int position;

    private CircuitParser(String text) {
        this.lines = text.split("\\R", -1);
    }

    public static Circuit parse(String text) {
        return new CircuitParser(text).parseBlock(false);
    }

    private Circuit parseBlock(boolean nested) {
        List<CircuitItem> items = new ArrayList<>();
        while (position < lines.length) {
            int lineNumber = position + 1;
            String line = stripComment(lines[position++]).trim();
            if (line.isEmpty()) {
                continue;
            }
            if (line.equals("}")) {
                if (!nested) {
                    throw error(lineNumber, "Unexpected '}' outside of a REPEAT block.");
                }
                return Circuit.of(items);
            }
            Matcher repeat = REPEAT.matcher(line);
            if (repeat.matches()) {
                int count = parseRepetitions(repeat.group(1), lineNumber);
                Circuit body = parseBlock(true);
                items.add(new RepeatBlock(count, body));
                continue;
            }
            items.add(parseInstruction(line, lineNumber));
        }
        if (nested) {
            throw error(lines.length, "Missing '}' closing a REPEAT block.");
        }
        return Circuit.of(items);
    }

    private static int parseRepetitions(String token, int lineNumber) {
        try {
            int count = Integer.parseInt(token);
            if (count < 1) {
                throw error(lineNumber, "REPEAT blocks need a repetition count of at least 1, got " + count + ".");
            }
            return count;
        } catch (NumberFormatException e) {
            throw new MalformedInstructionException(
                    "Line " + lineNumber + ": invalid REPEAT count '" + token + "'.", e);
        }
    }

    private static Instruction parseInstruction(String line, int lineNumber) {
        Matcher m = INSTRUCTION.matcher(line);
        if (!m.matches()) {
            throw error(lineNumber, "Cannot parse instruction '" + line + "'.");
        }
        String name = m.group(1);
        try {
            GateRegistry.standard().require(name);
        } catch (MalformedInstructionException e) {
            throw new MalformedInstructionException("Line " + lineNumber + ": " + e.getMessage(), e);
        }
        List<Double> args = parseArgs(m.group(2), lineNumber);
        List<Target> targets = parseTargets(m.group(3), lineNumber);
        return new Instruction(name, targets, args);
    }

    private static List<Double> parseArgs(String text, int lineNumber) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<Double> args = new ArrayList<>();
        for (String token : text.split(",")) {
            try {
                args.add(Double.parseDouble(token.trim()));
            } catch (NumberFormatException e) {
                throw new MalformedInstructionException(
                        "Line " + lineNumber + ": invalid argument '" + token.trim() + "'.", e);
            }
        }
        return args;
    }

    private static List<Target> parseTargets(String text, int lineNumber) {
        List<Target> targets = new ArrayList<>();
        if (text.isBlank()) {
            return targets;
        }
        // Combiners may be glued to their neighbours, as in X1*Z2.
        String spaced = text.replace("*", " * ");
        for (String token : spaced.trim().split("\\s+")) {
            targets.add(parseTarget(token, lineNumber));
        }
        return targets;
    }

    private static Target parseTarget(String token, int lineNumber) {
        if (token.equals("*")) {
            return Target.combiner();
        }
        try {
            Matcher record = RECORD.matcher(token);
            if (record.matches()) {
                return Target.record(Integer.parseInt(record.group(1)));
            }
            Matcher pauli = PAULI_TARGET.matcher(token);
            if (pauli.matches()) {
                Target target = Target.pauli(Pauli.fromChar(pauli.group(2).charAt(0)), Integer.parseInt(pauli.group(3)));
                return pauli.group(1).isEmpty() ? target
                        : new Target(Target.Kind.PAULI, target.value(), target.pauli(), true);
            }
            if (token.startsWith("!")) {
                return Target.invertedQubit(Integer.parseInt(token.substring(1)));
            }
            return Target.qubit(Integer.parseInt(token));
        } catch (IllegalArgumentException e) {
            throw new MalformedInstructionException(
                    "Line " + lineNumber + ": invalid target '" + token + "'.", e);
        }
    }

    private static String stripComment(String line) {
        int hash = line.indexOf('#');
        return hash >= 0 ? line.substring(0, hash) : line;
    }

    private static MalformedInstructionException error(int lineNumber, String message) {
        return new MalformedInstructionException("Line " + lineNumber + ": " + message);
    }
}
