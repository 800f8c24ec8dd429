package org.shaylang.compiler.api;

import org.shaylang.compiler.frontend.parser.ast.ProgramNode;

/**
 * The output of a successful compilation.
 *
 * @param generatedSource The complete program text in the target language.
 * @param program The AST the text was generated from.
 * @param statistics Counters collected during compilation.
 */
public record CompilationResult(
        String generatedSource,
        ProgramNode program,
        CompilationStatistics statistics
) {
}
