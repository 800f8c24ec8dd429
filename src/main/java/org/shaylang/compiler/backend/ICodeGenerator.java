package org.shaylang.compiler.backend;

import org.shaylang.compiler.frontend.parser.ast.ProgramNode;

import java.io.IOException;
import java.io.Writer;

/**
 * Translates a parsed program into one target language.
 * <p>
 * String and character literals arrive as the raw characters written between the quotes, with
 * escape sequences undecoded. Each backend re-encodes them for its target and fails with
 * {@code INVALID_ESCAPE_SEQUENCE} when an escape has no equivalent there.
 */
public interface ICodeGenerator {

    /**
     * Writes the translation of {@code program} to {@code out}. Output written before a failure
     * is discarded by the caller.
     *
     * @param program The program to translate. Its arena must not have been released.
     * @param out The destination.
     * @throws GenerationException if the program contains something this backend cannot translate.
     * @throws IOException if writing fails.
     */
    void generate(ProgramNode program, Writer out) throws GenerationException, IOException;
}
