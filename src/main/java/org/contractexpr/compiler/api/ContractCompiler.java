package org.contractexpr.compiler.api;

import org.contractexpr.compiler.diagnostics.CompilerLogger;
import org.contractexpr.compiler.diagnostics.ContractDiagnosticReporter;
import org.contractexpr.compiler.diagnostics.DiagnosticsEngine;
import org.contractexpr.compiler.frontend.contracts.ContractExpressionRecognizer;
import org.contractexpr.compiler.frontend.declaration.DeclarationNode;
import org.contractexpr.compiler.frontend.declaration.DeclarationParser;
import org.contractexpr.compiler.frontend.lexer.Lexer;
import org.contractexpr.compiler.frontend.lexer.Token;
import org.contractexpr.compiler.frontend.lowering.ContractLowerer;
import org.contractexpr.compiler.frontend.parser.TokenCursor;
import org.contractexpr.config.ContractOptions;

import java.util.List;

/**
 * The default {@link IContractCompiler}: lexer, declaration walker, recognizer and lowering.
 * <p>
 * Each call uses its own cursor and diagnostics, so one instance may lower several sources
 * concurrently.
 */
public class ContractCompiler implements IContractCompiler {

    private final ContractOptions options;
    private final ContractExpressionRecognizer recognizer;
    private final ContractLowerer lowerer;

    /**
     * Creates a compiler with the default options.
     */
    public ContractCompiler() {
        this(ContractOptions.defaults());
    }

    /**
     * Creates a compiler with the given options.
     * @param options The parser and lowering options.
     */
    public ContractCompiler(ContractOptions options) {
        this.options = options;
        this.recognizer = new ContractExpressionRecognizer(options);
        this.lowerer = new ContractLowerer(options);
    }

    @Override
    public LoweringResult lower(String source, String fileName) throws CompilationException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        CompilerLogger.debug("Lexing " + fileName);
        List<Token> tokens = new Lexer(source, diagnostics, fileName).scanTokens();
        if (diagnostics.hasErrors()) {
            throw new CompilationException(diagnostics.summary(), diagnostics.getDiagnostics());
        }

        TokenCursor cursor = new TokenCursor(tokens, diagnostics);
        DeclarationParser parser = new DeclarationParser(cursor, recognizer, lowerer,
                new ContractDiagnosticReporter(diagnostics));
        List<DeclarationNode> declarations = parser.parse();
        if (diagnostics.hasErrors()) {
            throw new CompilationException(diagnostics.summary(), diagnostics.getDiagnostics());
        }

        CompilerLogger.info("Lowered contracts of " + declarations.size() + " declaration(s) in " + fileName);
        return new LoweringResult(fileName, declarations, diagnostics.getDiagnostics());
    }

    /**
     * @return The options this compiler was created with.
     */
    public ContractOptions getOptions() {
        return options;
    }
}
