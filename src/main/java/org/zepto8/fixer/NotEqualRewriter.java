package org.zepto8.fixer;

import java.util.List;

/**
 * Rewrites {@code !=} operators to {@code ~=} in place. Both are two characters wide, so no
 * other offset in the text moves.
 */
final class NotEqualRewriter {
    private NotEqualRewriter() {}

    static String apply(String code, List<Integer> offsets) {
        if (offsets.isEmpty()) {
            return code;
        }
        var chars = code.toCharArray();
        for (int offset : offsets) {
            if (offset < 0 || offset + 1 >= chars.length || chars[offset] != '!' || chars[offset + 1] != '=') {
                throw new IllegalStateException("No '!=' operator at offset " + offset);
            }
            chars[offset] = '~';
        }
        return new String(chars);
    }
}
