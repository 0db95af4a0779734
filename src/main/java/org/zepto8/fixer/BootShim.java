package org.zepto8.fixer;

/**
 * Textual patch for the update-loop shim some PICO-8 versions append to cartridges.
 *
 * <p>The shim uses the single-line {@code if} form, which is rewritten to a regular
 * {@code if ... then ... end}. The leading newline keeps the new {@code if} from fusing with
 * the token before it (an {@code end} right before it would read as {@code endif}).
 */
public final class BootShim {
    static final String FRAGMENT = "if(_update60)_update=function()";
    static final String REPLACEMENT = "\nif(_update60)then _update=function()";
    static final String CLOSING = " end";

    private BootShim() {}

    public static boolean isPresent(String code) {
        return code.contains(FRAGMENT);
    }

    /**
     * Patch the first occurrence of the shim; code without it is returned unchanged.
     */
    public static String apply(String code) {
        int index = code.indexOf(FRAGMENT);
        if (index < 0) {
            return code;
        }
        return code.substring(0, index) + REPLACEMENT + code.substring(index + FRAGMENT.length()) + CLOSING;
    }
}
