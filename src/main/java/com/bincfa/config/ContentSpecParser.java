package com.bincfa.config;

import java.math.BigInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses initial content specifications of the form {@code <content>[!<taint>]}.
 *
 * <ul>
 *   <li>{@code 0x10} exact value (decimal accepted too)</li>
 *   <li>{@code 0x10?0xf0} value with a don't-care mask</li>
 *   <li>{@code |00ff12|} raw byte pattern, memory only</li>
 * </ul>
 * The taint part is either an exact value or a masked one.
 */
public final class ContentSpecParser {
    private static final Pattern NUMBER = Pattern.compile("(0[xX][0-9a-fA-F]+|[0-9]+)");
    private static final Pattern MASKED = Pattern.compile("(0[xX][0-9a-fA-F]+|[0-9]+)\\?(0[xX][0-9a-fA-F]+|[0-9]+)");
    private static final Pattern BYTES = Pattern.compile("\\|([0-9a-fA-F]*)\\|");

    private ContentSpecParser() {
    }

    /**
     * @param spec     the specification text
     * @param location what is being initialized, used in error messages (e.g. "register eax")
     */
    public static InitialSpec parse(String spec, String location) {
        if (spec == null || spec.trim().isEmpty()) {
            throw new IllegalConfigurationException("Empty initial content for " + location);
        }
        String text = spec.trim();
        int bang = text.indexOf('!');
        String contentPart = bang < 0 ? text : text.substring(0, bang).trim();
        InitialContent content = parseContent(contentPart, location);
        InitialTaint taint = bang < 0 ? null : parseTaint(text.substring(bang + 1).trim(), location);
        return new InitialSpec(content, taint);
    }

    static InitialContent parseContent(String text, String location) {
        Matcher m = BYTES.matcher(text);
        if (m.matches()) {
            String hex = m.group(1);
            if (hex.isEmpty() || hex.length() % 2 != 0) {
                throw new IllegalConfigurationException("Byte pattern must hold whole bytes for " + location + ": " + text);
            }
            byte[] bytes = new byte[hex.length() / 2];
            for (int i = 0; i < bytes.length; i++) {
                bytes[i] = (byte) Integer.parseInt(hex.substring(2 * i, 2 * i + 2), 16);
            }
            return InitialContent.bytes(bytes);
        }
        m = MASKED.matcher(text);
        if (m.matches()) {
            return InitialContent.masked(parseNumber(m.group(1)), parseNumber(m.group(2)));
        }
        if (NUMBER.matcher(text).matches()) {
            return InitialContent.exact(parseNumber(text));
        }
        throw new IllegalConfigurationException("Malformed initial content for " + location + ": " + text);
    }

    static InitialTaint parseTaint(String text, String location) {
        Matcher m = MASKED.matcher(text);
        if (m.matches()) {
            return InitialTaint.masked(parseNumber(m.group(1)), parseNumber(m.group(2)));
        }
        if (NUMBER.matcher(text).matches()) {
            return InitialTaint.exact(parseNumber(text));
        }
        throw new IllegalConfigurationException("Malformed initial taint for " + location + ": " + text);
    }

    /**
     * Parses a non-negative number written in hexadecimal ({@code 0x} prefix) or decimal.
     */
    public static BigInteger parseNumber(String text) {
        String t = text.trim();
        if (t.startsWith("0x") || t.startsWith("0X")) {
            return new BigInteger(t.substring(2), 16);
        }
        return new BigInteger(t);
    }
}
