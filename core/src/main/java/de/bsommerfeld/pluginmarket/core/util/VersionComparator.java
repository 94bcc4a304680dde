package de.bsommerfeld.pluginmarket.core.util;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Orders free-form plugin version strings such as {@code 1.2.0},
 * {@code 2.0-beta} or {@code v3a}.
 *
 * <h3>Tokens</h3>
 * A version is split into runs of ASCII digits (numeric tokens) and runs of
 * ASCII letters (text tokens, lower-cased). Every other character is a
 * separator that ends the current run and is dropped. A digit run that does
 * not fit into an unsigned 64-bit value is dropped as well.
 *
 * <h3>Comparison</h3>
 * The shorter token list is padded with numeric zeros, so {@code 1.0} equals
 * {@code 1.0.0}. Tokens are compared position by position:
 * <ul>
 * <li>number vs number: numeric order ({@code 1.10 > 1.2})</li>
 * <li>text vs text: lexicographic order</li>
 * <li>number vs text: the number is always smaller</li>
 * </ul>
 * The first unequal position decides.
 */
public final class VersionComparator implements Comparator<String> {

    public static final VersionComparator INSTANCE = new VersionComparator();

    private static final Token ZERO = Token.number(0);

    private VersionComparator() {
    }

    /**
     * Compares two version strings.
     *
     * @return negative if {@code a} is older, zero if equal, positive if newer
     */
    public static int compareVersions(String a, String b) {
        return INSTANCE.compare(a, b);
    }

    @Override
    public int compare(String a, String b) {
        List<Token> left = tokenize(a);
        List<Token> right = tokenize(b);

        int length = Math.max(left.size(), right.size());
        for (int i = 0; i < length; i++) {
            Token l = i < left.size() ? left.get(i) : ZERO;
            Token r = i < right.size() ? right.get(i) : ZERO;
            int result = l.compareTo(r);
            if (result != 0)
                return result;
        }
        return 0;
    }

    static List<Token> tokenize(String version) {
        List<Token> tokens = new ArrayList<>();
        if (version == null)
            return tokens;

        StringBuilder digits = new StringBuilder();
        StringBuilder letters = new StringBuilder();

        for (int i = 0; i < version.length(); i++) {
            char ch = version.charAt(i);
            if (ch >= '0' && ch <= '9') {
                flushText(letters, tokens);
                digits.append(ch);
            } else if ((ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z')) {
                flushNumber(digits, tokens);
                letters.append(ch);
            } else {
                flushNumber(digits, tokens);
                flushText(letters, tokens);
            }
        }
        flushNumber(digits, tokens);
        flushText(letters, tokens);
        return tokens;
    }

    private static void flushNumber(StringBuilder digits, List<Token> tokens) {
        if (digits.length() == 0)
            return;
        try {
            tokens.add(Token.number(Long.parseUnsignedLong(digits.toString())));
        } catch (NumberFormatException e) {
            // wider than 64 bits, dropped
        }
        digits.setLength(0);
    }

    private static void flushText(StringBuilder letters, List<Token> tokens) {
        if (letters.length() == 0)
            return;
        tokens.add(Token.text(letters.toString().toLowerCase(Locale.ROOT)));
        letters.setLength(0);
    }

    /**
     * One run of a tokenized version. {@code text} is {@code null} for
     * numeric tokens.
     */
    record Token(long number, String text) implements Comparable<Token> {

        static Token number(long value) {
            return new Token(value, null);
        }

        static Token text(String value) {
            return new Token(0, value);
        }

        boolean isNumeric() {
            return text == null;
        }

        @Override
        public int compareTo(Token other) {
            if (isNumeric() && other.isNumeric())
                return Long.compareUnsigned(number, other.number);
            if (!isNumeric() && !other.isNumeric())
                return text.compareTo(other.text);
            return isNumeric() ? -1 : 1;
        }
    }
}
