package org.shaylang.compiler.api;

/**
 * A position in the source code. Lines and columns are 1-based.
 *
 * @param line The line number.
 * @param column The column number.
 * @param fileName The logical file name, used for diagnostics only.
 */
public record SourcePosition(int line, int column, String fileName) {

    @Override
    public String toString() {
        return fileName + ":" + line + ":" + column;
    }
}
