package org.zepto8.fixer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zepto8.lua.LuaDialect;
import org.zepto8.lua.LuaGrammars;
import org.zepto8.peg.error.Diagnostic;
import org.zepto8.peg.error.ParseException;

import java.util.List;

/**
 * Translates PICO-8 Lua into standard Lua 5.3.
 *
 * <p>Fixing runs in four steps: the boot shim is patched, the PICO-8 grammar is checked (once
 * per process), the code is parsed with observers recording dialect constructs, and the
 * recorded constructs are rewritten. {@code !=} becomes {@code ~=} and compound assignments
 * are expanded; single-line {@code if} statements are only reported through
 * {@link #diagnostics()}.
 *
 * <p>Instances are not thread-safe. Repeated calls to {@link #fix()} produce the same result.
 */
public final class CodeFixer {
    private static final Logger log = LoggerFactory.getLogger(CodeFixer.class);

    private final String source;
    private final FixerConfig config;
    private final AnalysisContext context = new AnalysisContext();

    private CodeFixer(String source, FixerConfig config) {
        this.source = source;
        this.config = config;
    }

    public static CodeFixer create(String source) {
        return create(source, FixerConfig.DEFAULT);
    }

    public static CodeFixer create(String source, FixerConfig config) {
        if (source == null) {
            throw new IllegalArgumentException("source must not be null");
        }
        return new CodeFixer(source, config);
    }

    /**
     * Produce the corrected code.
     *
     * @throws ParseException if the code is not valid PICO-8 Lua; nothing is produced then
     * @throws IllegalStateException if output verification is enabled and the corrected code
     *                               does not parse as Lua 5.3
     */
    public String fix() throws ParseException {
        context.clear();
        var code = source;
        if (config.bootShimEnabled() && BootShim.isPresent(source)) {
            log.debug("Patching boot shim");
            code = BootShim.apply(source);
        }
        var parser = LuaGrammars.parser(LuaDialect.PICO8, config.parserConfig());

        log.info("Checking code");
        parser.parse(code, LuaGrammars.CHUNK, context.observers());
        log.info("Code seems valid");

        var notEquals = context.notEqualOffsets();
        for (int offset : notEquals) {
            log.info("!= operator at byte {}", offset);
        }
        // Fixed-width edits first, so copied assignment targets already carry '~='
        var fixed = NotEqualRewriter.apply(code, notEquals);
        fixed = CompoundAssignmentRewriter.apply(fixed, context.reassignments());
        log.debug("Rewrote {} '!=' operator(s) and {} compound assignment(s)",
                  notEquals.size(), context.reassignments().size());

        if (config.verifyOutput()) {
            verify(fixed);
        }
        return fixed;
    }

    private void verify(String fixed) {
        if (!context.diagnostics().isEmpty()) {
            log.warn("Skipping output verification: {} unsupported construct(s) left unchanged",
                     context.diagnostics().size());
            return;
        }
        try {
            LuaGrammars.check(fixed, LuaDialect.LUA53);
        } catch (ParseException e) {
            throw new IllegalStateException("Corrected code is not valid Lua 5.3: " + e.getMessage(), e);
        }
    }

    /**
     * Warnings from the last {@link #fix()}, one per unsupported construct.
     */
    public List<Diagnostic> diagnostics() {
        return context.diagnostics();
    }

    /**
     * Offsets of the {@code !=} operators rewritten by the last {@link #fix()}, relative to
     * the code after the boot shim patch.
     */
    public List<Integer> notEqualOffsets() {
        return context.notEqualOffsets();
    }

    /**
     * Compound assignments expanded by the last {@link #fix()}.
     */
    public List<Reassignment> reassignments() {
        return context.reassignments();
    }
}
