package org.shaylang.compiler.backend;

import org.shaylang.compiler.api.CompilerErrorCode;
import org.shaylang.compiler.frontend.parser.ast.ProgramNode;

import java.io.Writer;

/**
 * Placeholder for an output format that has no backend yet. Always fails without writing.
 */
public final class UnimplementedCodeGenerator implements ICodeGenerator {

    private final OutputFormat format;

    public UnimplementedCodeGenerator(OutputFormat format) {
        this.format = format;
    }

    @Override
    public void generate(ProgramNode program, Writer out) {
        throw new GenerationException(CompilerErrorCode.FORMAT_NOT_IMPLEMENTED,
                format.displayName() + " output not implemented", null);
    }
}
