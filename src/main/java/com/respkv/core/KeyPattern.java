package com.respkv.core;

import java.util.regex.Pattern;

/**
 * Redis-style glob pattern used by KEYS.
 *
 * Supported syntax:
 * <ul>
 *   <li>{@code *} any run of characters, including none</li>
 *   <li>{@code ?} exactly one character</li>
 *   <li>{@code [abc]}, {@code [a-z]}, {@code [^a]} character classes</li>
 *   <li>{@code \x} the literal character x</li>
 * </ul>
 * An unterminated {@code [} is matched literally.
 */
public final class KeyPattern {

    private final String glob;
    private final Pattern regex;
    private final boolean matchAll;

    private KeyPattern(String glob) {
        this.glob = glob;
        this.matchAll = "*".equals(glob);
        this.regex = matchAll ? null : Pattern.compile(toRegex(glob), Pattern.DOTALL);
    }

    /**
     * Compile a glob pattern.
     *
     * @param glob the pattern
     * @return the compiled pattern
     */
    public static KeyPattern compile(String glob) {
        if (glob == null) {
            throw new IllegalArgumentException("Pattern cannot be null");
        }
        return new KeyPattern(glob);
    }

    /**
     * Check whether a key matches this pattern in full.
     */
    public boolean matches(String key) {
        return matchAll || regex.matcher(key).matches();
    }

    public String getGlob() {
        return glob;
    }

    static String toRegex(String glob) {
        StringBuilder regex = new StringBuilder(glob.length() + 8);
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            switch (c) {
                case '*':
                    regex.append(".*");
                    i++;
                    break;
                case '?':
                    regex.append('.');
                    i++;
                    break;
                case '\\':
                    if (i + 1 < glob.length()) {
                        i = appendLiteral(regex, glob, i + 1);
                    } else {
                        regex.append("\\\\");
                        i++;
                    }
                    break;
                case '[':
                    i = appendClass(regex, glob, i);
                    break;
                default:
                    i = appendLiteral(regex, glob, i);
            }
        }
        return regex.toString();
    }

    /**
     * Append a character class starting at {@code start} (the '[').
     *
     * @return index just past the closing ']'
     */
    private static int appendClass(StringBuilder regex, String glob, int start) {
        int close = findClassEnd(glob, start + 1);
        if (close < 0) {
            regex.append("\\[");
            return start + 1;
        }

        int i = start + 1;
        boolean negate = i < close && glob.charAt(i) == '^';
        if (negate) {
            i++;
        }
        if (i == close) {
            // [] never matches, [^] matches any single character
            regex.append(negate ? "." : "(?!)");
            return close + 1;
        }

        regex.append('[');
        if (negate) {
            regex.append('^');
        }
        while (i < close) {
            char c = glob.charAt(i);
            if (c == '\\' && i + 1 < close) {
                i++;
                c = glob.charAt(i);
            }
            if (i + 2 < close && glob.charAt(i + 1) == '-') {
                char hi = glob.charAt(i + 2);
                char lo = c;
                if (lo > hi) {
                    char tmp = lo;
                    lo = hi;
                    hi = tmp;
                }
                appendClassChar(regex, lo);
                regex.append('-');
                appendClassChar(regex, hi);
                i += 3;
            } else {
                appendClassChar(regex, c);
                i++;
            }
        }
        regex.append(']');
        return close + 1;
    }

    private static int findClassEnd(String glob, int from) {
        int i = from;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == ']') {
                return i;
            }
            i++;
        }
        return -1;
    }

    private static void appendClassChar(StringBuilder regex, char c) {
        if (c < 128 && !Character.isLetterOrDigit(c)) {
            regex.append('\\');
        }
        regex.append(c);
    }

    private static int appendLiteral(StringBuilder regex, String glob, int index) {
        int codePoint = glob.codePointAt(index);
        if (codePoint < 128 && !Character.isLetterOrDigit(codePoint)) {
            regex.append('\\');
        }
        regex.appendCodePoint(codePoint);
        return index + Character.charCount(codePoint);
    }

    @Override
    public String toString() {
        return glob;
    }
}
