package org.contractexpr.compiler.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Defines the public interface for lowering contract expressions in source text.
 */
public interface IContractCompiler {

    /**
     * Lexes the source, finds every declaration and lowers its contracts.
     *
     * @param source The source text.
     * @param fileName A name for the source, used in diagnostics.
     * @return The lowered declarations and any warnings.
     * @throws CompilationException if at least one error was reported.
     */
    LoweringResult lower(String source, String fileName) throws CompilationException;

    /**
     * Lowers the contents of a file.
     * @param path The file to read.
     * @return The lowered declarations and any warnings.
     * @throws CompilationException if at least one error was reported.
     * @throws IOException if the file cannot be read.
     */
    default LoweringResult lower(Path path) throws CompilationException, IOException {
        return lower(Files.readString(path), path.toString());
    }
}
