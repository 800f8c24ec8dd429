package org.shaylang.compiler.backend.c;

import org.shaylang.compiler.api.CompilerErrorCode;
import org.shaylang.compiler.api.SourcePosition;
import org.shaylang.compiler.backend.GenerationException;

/**
 * Turns the raw text between the quotes of a string or character literal into a valid C literal body.
 * <p>
 * Escapes are copied as written where C reads them the same way. Raw line breaks become
 * {@code \n} and {@code \r}. A universal character name that C does not accept below U+00A0 is
 * rewritten as a hex escape. When a hex or octal escape is followed by a character C would read as
 * part of it, the string literal is split ({@code "\x41" "B"}). Incomplete hex and universal
 * character escapes, and surrogate code points, cannot be represented and fail the generation.
 */
final class CLiterals {

    private enum Pending { NONE, HEX, OCTAL }

    private CLiterals() {}

    static String string(String raw, SourcePosition position) {
        return encode(raw, position, "string");
    }

    static String character(String raw, SourcePosition position) {
        return encode(raw, position, "character");
    }

    private static String encode(String raw, SourcePosition position, String kind) {
        StringBuilder out = new StringBuilder(raw.length() + 8);
        Pending pending = Pending.NONE;
        int i = 0;
        while (i < raw.length()) {
            char c = raw.charAt(i);
            if (c != '\\') {
                if (continues(pending, c)) {
                    out.append("\"\"");
                }
                if (c == '\n') {
                    out.append("\\n");
                } else if (c == '\r') {
                    out.append("\\r");
                } else {
                    out.append(c);
                }
                pending = Pending.NONE;
                i++;
                continue;
            }

            if (i + 1 >= raw.length()) {
                throw invalid(position, "Dangling backslash in " + kind + " literal");
            }
            char escaped = raw.charAt(i + 1);
            if (escaped == 'x') {
                int end = hexDigitsEnd(raw, i + 2, 2);
                if (end == i + 2) {
                    throw invalid(position, "Hex escape without digits in " + kind + " literal");
                }
                out.append(raw, i, end);
                pending = Pending.HEX;
                i = end;
            } else if (escaped == 'u') {
                int end = hexDigitsEnd(raw, i + 2, 4);
                if (end - (i + 2) < 4) {
                    throw invalid(position, "Universal character escape needs four hex digits in " + kind + " literal");
                }
                int codePoint = Integer.parseInt(raw.substring(i + 2, end), 16);
                if (codePoint >= 0xD800 && codePoint <= 0xDFFF) {
                    throw invalid(position, String.format("Surrogate U+%04X cannot appear in a C %s literal", codePoint, kind));
                }
                if (codePoint < 0xA0 && codePoint != '$' && codePoint != '@' && codePoint != '`') {
                    out.append(String.format("\\x%02x", codePoint));
                    pending = Pending.HEX;
                } else {
                    out.append(raw, i, end);
                    pending = Pending.NONE;
                }
                i = end;
            } else {
                out.append(c).append(escaped);
                pending = escaped >= '0' && escaped <= '7' ? Pending.OCTAL : Pending.NONE;
                i += 2;
            }
        }
        return out.toString();
    }

    private static boolean continues(Pending pending, char next) {
        switch (pending) {
            case HEX: return Character.digit(next, 16) >= 0 && next < 128;
            case OCTAL: return next >= '0' && next <= '7';
            default: return false;
        }
    }

    private static int hexDigitsEnd(String raw, int start, int max) {
        int end = start;
        while (end < raw.length() && end - start < max
                && Character.digit(raw.charAt(end), 16) >= 0 && raw.charAt(end) < 128) {
            end++;
        }
        return end;
    }

    private static GenerationException invalid(SourcePosition position, String message) {
        return new GenerationException(CompilerErrorCode.INVALID_ESCAPE_SEQUENCE, message, position);
    }
}
