package org.zepto8.lua;

/**
 * Source languages recognized by {@link LuaGrammars}.
 */
public enum LuaDialect {
    /**
     * Standard Lua 5.3.
     */
    LUA53,
    /**
     * Lua 5.3 plus the PICO-8 shorthand: {@code !=}, compound assignment and single-line {@code if}.
     */
    PICO8
}
