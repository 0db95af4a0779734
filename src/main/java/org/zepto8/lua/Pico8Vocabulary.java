package org.zepto8.lua;

import java.util.Set;

/**
 * Reserved words and console built-in function names, as listed by the code editor.
 */
public final class Pico8Vocabulary {

    public enum WordKind {
        KEYWORD,
        BUILTIN,
        IDENTIFIER
    }

    public static final Set<String> KEYWORDS = Set.of(
        "and", "break", "do", "else", "elseif", "end", "false", "for", "function", "goto", "if",
        "in", "local", "nil", "not", "or", "repeat", "return", "then", "true", "until", "while");

    public static final Set<String> BUILTINS = Set.of(
        // math
        "max", "min", "mid", "ceil", "flr", "cos", "sin", "atan2", "sqrt", "abs", "sgn",
        "band", "bor", "bxor", "bnot", "shl", "shr", "lshr", "rotl", "rotr",
        "tostr", "tonum", "srand", "rnd",
        // system and memory
        "run", "menuitem", "reload", "peek", "peek4", "poke", "poke4", "memcpy", "memset",
        "stat", "printh", "extcmd", "_update_buttons", "btn", "btnp",
        // graphics
        "cursor", "print", "camera", "circ", "circfill", "clip", "cls", "color", "fillp",
        "fget", "fset", "line", "map", "mget", "mset", "pal", "palt", "pget", "pset",
        "rect", "rectfill", "sget", "sset", "spr", "sspr", "mapdraw", "flip",
        // sound
        "music", "sfx",
        // coroutines and tables
        "time", "t", "cocreate", "coresume", "costatus", "yield", "trace", "stop",
        "count", "add", "sub", "foreach", "all", "del", "assert", "getmetatable", "setmetatable",
        // cartridge data and console commands
        "dget", "dset", "cartdata", "load", "save", "info", "abort", "folder", "resume",
        "reboot", "dir", "ls");

    private Pico8Vocabulary() {}

    public static boolean isKeyword(String word) {
        return KEYWORDS.contains(word);
    }

    public static boolean isBuiltin(String word) {
        return BUILTINS.contains(word);
    }

    public static WordKind classify(String word) {
        if (isKeyword(word)) {
            return WordKind.KEYWORD;
        }
        return isBuiltin(word)
               ? WordKind.BUILTIN
               : WordKind.IDENTIFIER;
    }
}
