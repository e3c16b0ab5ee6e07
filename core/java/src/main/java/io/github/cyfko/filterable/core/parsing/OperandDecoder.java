package io.github.cyfko.filterable.core.parsing;

import io.github.cyfko.filterable.core.model.Operand;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Percent-decodes filter operands.
 * <p>
 * String leaves are URL-decoded ({@code +} becomes a space, {@code %XX} becomes the byte
 * {@code XX}, bytes are read as UTF-8). Other scalars are returned unchanged and sequences keep
 * their shape and order at any depth.
 * </p>
 * <p>
 * Unlike {@link java.net.URLDecoder}, decoding never fails: an escape that is not followed by
 * two hexadecimal digits ({@code %zz}, a trailing {@code %}) is kept literally.
 * </p>
 *
 * <pre>{@code
 * OperandDecoder.decode("caf%C3%A9+cr%C3%A8me") // "café crème"
 * OperandDecoder.decode("100%")                  // "100%"
 * }</pre>
 *
 * <p>This class is designed to be used statically and cannot be instantiated.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class OperandDecoder {

    private OperandDecoder() {}

    /**
     * Decodes every string leaf of an operand.
     *
     * @param operand operand to decode
     * @return operand of the same shape
     */
    public static Operand decode(Operand operand) {
        if (operand instanceof Operand.Sequence sequence) {
            List<Operand> decoded = new ArrayList<>(sequence.size());
            for (Operand item : sequence.items()) {
                decoded.add(decode(item));
            }
            return new Operand.Sequence(decoded);
        }

        Object value = operand.unwrap();
        return value instanceof String text ? new Operand.Scalar(decode(text)) : operand;
    }

    /**
     * Decodes one percent-encoded string.
     *
     * @param text encoded text, may be {@code null}
     * @return decoded text, {@code null} for {@code null}
     */
    public static String decode(String text) {
        if (text == null || (text.indexOf('%') < 0 && text.indexOf('+') < 0)) {
            return text;
        }

        StringBuilder result = new StringBuilder(text.length());
        ByteArrayOutputStream pending = new ByteArrayOutputStream();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '%' && i + 2 < text.length() && isHex(text.charAt(i + 1)) && isHex(text.charAt(i + 2))) {
                pending.write((Character.digit(text.charAt(i + 1), 16) << 4) | Character.digit(text.charAt(i + 2), 16));
                i += 3;
                continue;
            }

            flush(pending, result);
            result.append(c == '+' ? ' ' : c);
            i++;
        }
        flush(pending, result);
        return result.toString();
    }

    private static boolean isHex(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static void flush(ByteArrayOutputStream pending, StringBuilder result) {
        if (pending.size() > 0) {
            result.append(pending.toString(StandardCharsets.UTF_8));
            pending.reset();
        }
    }
}
