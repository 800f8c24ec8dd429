package org.shaylang.compiler.backend;

/**
 * The target languages a program can be translated to. Only {@link #C} has a working backend;
 * the others are reserved extension points.
 */
public enum OutputFormat {
    C("C", ".c"),
    JAVASCRIPT("JavaScript", ".js"),
    PYTHON("Python", ".py"),
    BYTECODE("Bytecode", ".bc");

    private final String displayName;
    private final String fileExtension;

    OutputFormat(String displayName, String fileExtension) {
        this.displayName = displayName;
        this.fileExtension = fileExtension;
    }

    /**
     * @return The human-readable name used in messages.
     */
    public String displayName() {
        return displayName;
    }

    /**
     * @return The conventional extension of generated files, including the dot.
     */
    public String fileExtension() {
        return fileExtension;
    }
}
