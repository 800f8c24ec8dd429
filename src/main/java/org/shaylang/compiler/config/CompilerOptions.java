package org.shaylang.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.shaylang.compiler.memory.Arena;

/**
 * Typed view of the {@code shaylang} configuration section.
 *
 * <pre>
 * shaylang {
 *   arena {
 *     block-size = 65536
 *     max-blocks = 256
 *   }
 *   codegen {
 *     indent = 4
 *     suppress-redundant-return = true
 *   }
 * }
 * </pre>
 *
 * @param arenaBlockSize Size of one arena block in bytes.
 * @param arenaMaxBlocks Maximum number of arena blocks per compilation.
 * @param indentWidth Spaces per indentation level in generated code.
 * @param suppressRedundantReturn Whether to omit {@code return 0;} after a final return statement.
 */
public record CompilerOptions(
        int arenaBlockSize,
        int arenaMaxBlocks,
        int indentWidth,
        boolean suppressRedundantReturn
) {

    private static final String BLOCK_SIZE_PATH = "arena.block-size";

    public CompilerOptions {
        if (arenaBlockSize <= 0) {
            throw new IllegalArgumentException("shaylang.arena.block-size must be positive: " + arenaBlockSize);
        }
        if (arenaMaxBlocks <= 0) {
            throw new IllegalArgumentException("shaylang.arena.max-blocks must be positive: " + arenaMaxBlocks);
        }
        if (indentWidth < 0) {
            throw new IllegalArgumentException("shaylang.codegen.indent must not be negative: " + indentWidth);
        }
    }

    /**
     * @return The options as shipped in {@code reference.conf}.
     */
    public static CompilerOptions defaults() {
        return fromConfig(ConfigFactory.parseResources("reference.conf").resolve());
    }

    /**
     * Reads the options from a resolved configuration.
     *
     * @param config The configuration containing a {@code shaylang} section.
     * @return The typed options.
     * @throws ConfigException if a required key is missing, has the wrong type, or the block size exceeds 2 GiB - 1.
     */
    public static CompilerOptions fromConfig(Config config) {
        Config root = config.getConfig("shaylang");
        return new CompilerOptions(
                blockSize(root),
                root.getInt("arena.max-blocks"),
                root.getInt("codegen.indent"),
                root.getBoolean("codegen.suppress-redundant-return"));
    }

    private static int blockSize(Config root) {
        long bytes = root.getMemorySize(BLOCK_SIZE_PATH).toBytes();
        if (bytes > Integer.MAX_VALUE) {
            throw new ConfigException.BadValue(root.getValue(BLOCK_SIZE_PATH).origin(), "shaylang." + BLOCK_SIZE_PATH,
                    "must not exceed " + Integer.MAX_VALUE + " bytes, was " + bytes);
        }
        return (int) bytes;
    }

    /**
     * @return A new arena sized according to these options.
     */
    public Arena newArena() {
        return new Arena(arenaBlockSize, arenaMaxBlocks);
    }
}
