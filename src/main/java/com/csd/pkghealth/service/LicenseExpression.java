package com.csd.pkghealth.service;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * One level of an SPDX expression. {@code AND} binds tighter than {@code OR}, and a
 * parenthesised group is a single operand, so the operands of a dual license may themselves
 * be conjunctions or groups. Operands are kept as text and parsed again when evaluated.
 */
@Value
public class LicenseExpression {

    String expression;
    List<String> operands;
    boolean dual;
    boolean conjunctive;

    public static LicenseExpression parse(String license) {
        List<String> tokens = unwrap(tokenize(license));

        List<List<String>> alternatives = splitTopLevel(tokens, "OR");
        if (alternatives.size() > 1) {
            return new LicenseExpression(render(tokens), renderAll(alternatives), true, false);
        }
        List<List<String>> terms = splitTopLevel(tokens, "AND");
        if (terms.size() > 1) {
            return new LicenseExpression(render(tokens), renderAll(terms), false, true);
        }

        // a lone operand keeps no stray parentheses
        List<String> words = new ArrayList<>();
        for (String token : tokens) {
            if (!isParen(token)) {
                words.add(token);
            }
        }
        String single = String.join(" ", words);
        return new LicenseExpression(single, List.of(single), false, false);
    }

    public boolean isSingle() {
        return !dual && !conjunctive;
    }

    private static List<String> tokenize(String license) {
        List<String> tokens = new ArrayList<>();
        StringBuilder word = new StringBuilder();
        for (char c : license.toCharArray()) {
            if (c == '(' || c == ')' || Character.isWhitespace(c)) {
                if (word.length() > 0) {
                    tokens.add(word.toString());
                    word.setLength(0);
                }
                if (c == '(' || c == ')') {
                    tokens.add(String.valueOf(c));
                }
            } else {
                word.append(c);
            }
        }
        if (word.length() > 0) {
            tokens.add(word.toString());
        }
        return tokens;
    }

    // drops parentheses enclosing the whole expression, however deeply nested
    private static List<String> unwrap(List<String> tokens) {
        List<String> current = tokens;
        while (current.size() >= 2 && "(".equals(current.get(0)) && ")".equals(current.get(current.size() - 1))
                && closingIndex(current) == current.size() - 1) {
            current = current.subList(1, current.size() - 1);
        }
        return current;
    }

    private static int closingIndex(List<String> tokens) {
        int depth = 0;
        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);
            if ("(".equals(token)) {
                depth++;
            } else if (")".equals(token)) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static List<List<String>> splitTopLevel(List<String> tokens, String operator) {
        List<List<String>> parts = new ArrayList<>();
        List<String> part = new ArrayList<>();
        int depth = 0;
        for (String token : tokens) {
            if ("(".equals(token)) {
                depth++;
            } else if (")".equals(token)) {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && operator.equals(token.toUpperCase(Locale.ROOT))) {
                addPart(parts, part);
                part = new ArrayList<>();
                continue;
            }
            part.add(token);
        }
        addPart(parts, part);
        return parts;
    }

    private static void addPart(List<List<String>> parts, List<String> part) {
        if (part.stream().anyMatch(token -> !isParen(token))) {
            parts.add(part);
        }
    }

    private static List<String> renderAll(List<List<String>> parts) {
        List<String> rendered = new ArrayList<>(parts.size());
        for (List<String> part : parts) {
            rendered.add(render(unwrap(part)));
        }
        return List.copyOf(rendered);
    }

    // "(MIT OR Apache-2.0) AND GPL-3.0-only"
    private static String render(List<String> tokens) {
        StringBuilder out = new StringBuilder();
        String previous = null;
        for (String token : tokens) {
            boolean spaced = previous != null && !"(".equals(previous) && !")".equals(token);
            if (spaced) {
                out.append(' ');
            }
            out.append(token);
            previous = token;
        }
        return out.toString();
    }

    private static boolean isParen(String token) {
        return "(".equals(token) || ")".equals(token);
    }
}
