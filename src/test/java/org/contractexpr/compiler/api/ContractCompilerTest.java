package org.contractexpr.compiler.api;

import org.contractexpr.compiler.diagnostics.Diagnostic;
import org.contractexpr.compiler.frontend.declaration.AggregateDeclarationNode;
import org.contractexpr.compiler.frontend.declaration.FunctionDeclarationNode;
import org.contractexpr.compiler.frontend.lowering.SourcePrinter;
import org.contractexpr.config.ContractOptions;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Contains end-to-end tests for the {@link ContractCompiler} facade, from source text
 * to lowered declarations or diagnostics.
 */
public class ContractCompilerTest {

    /**
     * Verifies that a source with functions and a class is lowered completely.
     */
    @Test
    @Tag("unit")
    void testLowersWholeSource() throws Exception {
        // Arrange
        String source = String.join("\n",
                "int div(int a, int b) in(b != 0, \"division by zero\") out(r; r * b <= a) { return a / b; }",
                "struct Range {",
                "    int lo; int hi;",
                "    invariant(lo <= hi);",
                "}");
        IContractCompiler compiler = new ContractCompiler();

        // Act
        LoweringResult result = compiler.lower(source, "range.d");

        // Assert
        assertThat(result.fileName()).isEqualTo("range.d");
        assertThat(result.diagnostics()).isEmpty();
        assertThat(result.declarations()).hasSize(2);
        FunctionDeclarationNode div = (FunctionDeclarationNode) result.declarations().get(0);
        assertThat(SourcePrinter.printAll(div.contracts())).isEqualTo(String.join("\n",
                "in { assert(b != 0, \"division by zero\"); }",
                "out(r) { assert(r * b <= a); }"));
        AggregateDeclarationNode range = (AggregateDeclarationNode) result.declarations().get(1);
        assertThat(SourcePrinter.printAll(range.invariants())).isEqualTo("invariant { assert(lo <= hi); }");
    }

    /**
     * Verifies that errors from several declarations are collected into one exception.
     */
    @Test
    @Tag("unit")
    void testCollectsAllErrors() {
        // Arrange
        String source = String.join("\n",
                "int f(int i) out(i) do { }",
                "int g() in(a b) { }");

        // Act
        CompilationException e = catchThrowableOfType(
                () -> new ContractCompiler().lower(source, "bad.d"), CompilationException.class);

        // Assert
        assertThat(e.getDiagnostics()).extracting(Diagnostic::code).containsExactly(
                CompilerErrorCode.AMBIGUOUS_OUT_EXPRESSION,
                CompilerErrorCode.MALFORMED_CONTRACT_PARAMETERS);
        assertThat(e.getMessage()).contains("bad.d:1:14", "bad.d:2:14");
    }

    /**
     * Verifies that lexical errors stop the run before parsing.
     */
    @Test
    @Tag("unit")
    void testLexerErrorsFailTheRun() {
        // Act
        CompilationException e = catchThrowableOfType(
                () -> new ContractCompiler().lower("int f() in(a, \"open) { }", "lex.d"), CompilationException.class);

        // Assert
        assertThat(e.getDiagnostics()).extracting(Diagnostic::code)
                .containsExactly(CompilerErrorCode.UNTERMINATED_STRING);
    }

    /**
     * Verifies that the options reach the lowering step and that files can be lowered directly.
     */
    @Test
    @Tag("unit")
    void testLowersFileWithOptions(@TempDir Path tempDir) throws Exception {
        // Arrange
        Path file = tempDir.resolve("check.d");
        Files.writeString(file, "void f(int a) in(a > 0,) { }");
        ContractCompiler compiler = new ContractCompiler(new ContractOptions(true, "enforce", 2));

        // Act
        LoweringResult result = compiler.lower(file);

        // Assert
        assertThat(result.fileName()).isEqualTo(file.toString());
        FunctionDeclarationNode f = (FunctionDeclarationNode) result.declarations().get(0);
        assertThat(SourcePrinter.print(f.contracts().get(0))).isEqualTo("in { enforce(a > 0); }");
        assertThat(compiler.getOptions().assertFunction()).isEqualTo("enforce");
    }

    /**
     * Verifies that warnings do not fail the run and are returned with the result.
     */
    @Test
    @Tag("unit")
    void testWarningsAreReturned() throws Exception {
        // Act
        LoweringResult result = new ContractCompiler().lower("void f() in { } out { assert(ok); } { }", "warn.d");

        // Assert
        assertThat(result.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.type()).isEqualTo(Diagnostic.Type.WARNING);
            assertThat(d.code()).isEqualTo(CompilerErrorCode.EMPTY_CONTRACT_BLOCK);
        });
        FunctionDeclarationNode f = (FunctionDeclarationNode) result.declarations().get(0);
        assertThat(SourcePrinter.printAll(f.contracts())).isEqualTo("out { assert(ok); }");
    }

    /**
     * Verifies that diagnostics after a string with an escaped line break point at the real line.
     */
    @Test
    @Tag("unit")
    void testPositionsAfterMultiLineString() {
        // Act
        CompilationException e = catchThrowableOfType(
                () -> new ContractCompiler().lower("int f(\"x\\\n y\") in(a b) { }", "p.d"), CompilationException.class);

        // Assert
        assertThat(e.getDiagnostics()).singleElement().satisfies(d -> {
            assertThat(d.code()).isEqualTo(CompilerErrorCode.MALFORMED_CONTRACT_PARAMETERS);
            assertThat(d.lineNumber()).isEqualTo(2);
            assertThat(d.columnNumber()).isEqualTo(11);
        });
    }
}
