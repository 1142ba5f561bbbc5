package org.contractexpr.compiler.frontend.declaration;

import org.contractexpr.compiler.api.CompilerErrorCode;
import org.contractexpr.compiler.diagnostics.CompilerLogger;
import org.contractexpr.compiler.diagnostics.ContractDiagnosticReporter;
import org.contractexpr.compiler.frontend.contracts.ContractContext;
import org.contractexpr.compiler.frontend.contracts.ContractExpressionRecognizer;
import org.contractexpr.compiler.frontend.contracts.ContractGroup;
import org.contractexpr.compiler.frontend.lexer.Token;
import org.contractexpr.compiler.frontend.lexer.TokenType;
import org.contractexpr.compiler.frontend.lowering.ContractLowerer;
import org.contractexpr.compiler.frontend.lowering.LoweredContract;
import org.contractexpr.compiler.frontend.parser.ContractParseError;
import org.contractexpr.compiler.frontend.parser.ParsingContext;
import org.contractexpr.compiler.internal.i18n.Messages;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * A minimal declaration walker that finds function declarators and aggregate bodies and
 * hands them to the contract recognizer and the lowering step.
 * <p>
 * Only what is needed to locate contracts is understood: types, parameter lists and function
 * bodies are skipped as balanced token ranges, and fields are dropped. A failing declaration is
 * reported and the parser resynchronizes at the next {@code ;} or block.
 */
public class DeclarationParser {

    private static final Set<String> AGGREGATE_KEYWORDS = Set.of("class", "struct", "interface");
    private static final Set<String> LEADING_ATTRIBUTES = Set.of(
            "abstract", "final", "static", "public", "private", "protected", "package", "export", "override");
    private static final Set<String> CONTRACT_OR_BODY_KEYWORDS = Set.of("in", "out", "do", "body");

    private final ParsingContext cursor;
    private final ContractExpressionRecognizer recognizer;
    private final ContractLowerer lowerer;
    private final ContractDiagnosticReporter reporter;

    /**
     * Creates a declaration parser.
     * @param cursor The cursor over the whole source.
     * @param recognizer The contract recognizer.
     * @param lowerer The lowering step.
     * @param reporter Receives every failure.
     */
    public DeclarationParser(ParsingContext cursor, ContractExpressionRecognizer recognizer,
                             ContractLowerer lowerer, ContractDiagnosticReporter reporter) {
        this.cursor = cursor;
        this.recognizer = recognizer;
        this.lowerer = lowerer;
        this.reporter = reporter;
    }

    /**
     * Parses all declarations up to the end of the token stream.
     * @return The successfully parsed declarations; failed ones are reported and left out.
     */
    public List<DeclarationNode> parse() {
        List<DeclarationNode> declarations = new ArrayList<>();
        while (!cursor.isAtEnd()) {
            int before = cursor.mark();
            try {
                DeclarationNode declaration = declaration(ContractContext.FUNCTION);
                if (declaration != null) {
                    declarations.add(declaration);
                }
            } catch (ContractParseError e) {
                reporter.report(e);
                synchronize(false);
                if (cursor.mark() == before) cursor.advance();
            }
        }
        return declarations;
    }

    private DeclarationNode declaration(ContractContext memberContext) {
        if (cursor.match(TokenType.SEMICOLON)) {
            return null;
        }
        ContractContext context = memberContext;
        while (cursor.check(TokenType.IDENTIFIER) && LEADING_ATTRIBUTES.contains(cursor.peek().text())) {
            if (cursor.advance().text().equals("abstract")) {
                context = ContractContext.INTERFACE;
            }
        }
        if (cursor.check(TokenType.IDENTIFIER) && AGGREGATE_KEYWORDS.contains(cursor.peek().text())) {
            return aggregate();
        }
        return function(context);
    }

    private AggregateDeclarationNode aggregate() {
        Token keyword = cursor.advance();
        Token name = cursor.consume(TokenType.IDENTIFIER, CompilerErrorCode.UNEXPECTED_TOKEN,
                Messages.get("declaration.expectedName", keyword.text(), describe(cursor.peek())));
        // Base class and interface lists are not needed for contracts.
        while (!cursor.check(TokenType.LEFT_BRACE) && !cursor.isAtEnd()) {
            cursor.advance();
        }
        cursor.consume(TokenType.LEFT_BRACE, CompilerErrorCode.UNEXPECTED_TOKEN,
                Messages.get("parser.expectedBlock", describe(cursor.peek())));

        boolean isInterface = keyword.text().equals("interface");
        ContractContext memberContext = isInterface ? ContractContext.INTERFACE : ContractContext.FUNCTION;
        ContractGroup invariants = ContractGroup.empty();
        List<DeclarationNode> members = new ArrayList<>();

        while (!cursor.check(TokenType.RIGHT_BRACE)) {
            if (cursor.isAtEnd()) {
                throw new ContractParseError(CompilerErrorCode.UNEXPECTED_TOKEN,
                        Messages.get("declaration.unclosedAggregate", name.text()), cursor.peek());
            }
            int before = cursor.mark();
            try {
                if (!isInterface) {
                    ContractGroup group = recognizer.parseContracts(cursor, ContractContext.AGGREGATE);
                    if (!group.isEmpty()) {
                        invariants = invariants.concat(group);
                        continue;
                    }
                }
                DeclarationNode member = declaration(memberContext);
                if (member != null) {
                    members.add(member);
                }
            } catch (ContractParseError e) {
                reporter.report(e);
                synchronize(true);
                if (cursor.mark() == before && !cursor.check(TokenType.RIGHT_BRACE)) cursor.advance();
            }
        }
        cursor.advance(); // consume '}'

        List<LoweredContract> lowered = lowerer.lower(invariants);
        CompilerLogger.debug("Aggregate " + name.text() + ": " + lowered.size() + " invariant contract(s), "
                + members.size() + " member(s).");
        return new AggregateDeclarationNode(keyword, name, lowered, members);
    }

    /**
     * Parses {@code type name(params) contracts (body | ;)}. Returns null for fields.
     */
    private FunctionDeclarationNode function(ContractContext context) {
        while (!(cursor.check(TokenType.IDENTIFIER) && cursor.checkNext(TokenType.LEFT_PAREN))) {
            if (cursor.match(TokenType.SEMICOLON)) {
                return null;
            }
            if (cursor.peek().isOperator("=")) {
                // Field initializer, which may contain calls.
                while (!cursor.isAtEnd() && !cursor.match(TokenType.SEMICOLON)) cursor.advance();
                return null;
            }
            if (cursor.isAtEnd() || cursor.check(TokenType.LEFT_BRACE) || cursor.check(TokenType.RIGHT_BRACE)) {
                throw new ContractParseError(CompilerErrorCode.UNEXPECTED_TOKEN,
                        Messages.get("declaration.expectedDeclaration", describe(cursor.peek())), cursor.peek());
            }
            if (cursor.check(TokenType.LEFT_PAREN)) {
                skipBalanced(TokenType.LEFT_PAREN, TokenType.RIGHT_PAREN);
            } else {
                cursor.advance();
            }
        }
        Token name = cursor.advance();
        skipBalanced(TokenType.LEFT_PAREN, TokenType.RIGHT_PAREN);
        if (cursor.check(TokenType.LEFT_PAREN)) {
            // Template parameters come first: name(T)(T value).
            skipBalanced(TokenType.LEFT_PAREN, TokenType.RIGHT_PAREN);
        }
        skipFunctionAttributes();

        ContractGroup group = recognizer.parseContracts(cursor, context);
        List<LoweredContract> contracts = lowerer.lower(group);

        boolean hasBody;
        if (group.isTerminated() || cursor.match(TokenType.SEMICOLON)) {
            hasBody = false;
        } else if (cursor.checkKeyword("do") || cursor.checkKeyword("body")) {
            cursor.advance();
            skipBalanced(TokenType.LEFT_BRACE, TokenType.RIGHT_BRACE);
            hasBody = true;
        } else if (cursor.check(TokenType.LEFT_BRACE)) {
            skipBalanced(TokenType.LEFT_BRACE, TokenType.RIGHT_BRACE);
            hasBody = true;
        } else {
            throw new ContractParseError(CompilerErrorCode.UNEXPECTED_TOKEN,
                    Messages.get("declaration.expectedBody", name.text(), describe(cursor.peek())), cursor.peek());
        }
        return new FunctionDeclarationNode(name, context, contracts, hasBody);
    }

    // const, pure, nothrow, @safe and similar; contracts and bodies start with in/out/do/body/{/;.
    private void skipFunctionAttributes() {
        while (true) {
            if (cursor.peek().isOperator("@") && cursor.peek(1).type() == TokenType.IDENTIFIER) {
                cursor.advance();
                cursor.advance();
            } else if (cursor.check(TokenType.IDENTIFIER)
                    && !CONTRACT_OR_BODY_KEYWORDS.contains(cursor.peek().text())) {
                cursor.advance();
            } else {
                return;
            }
        }
    }

    private void skipBalanced(TokenType open, TokenType close) {
        Token start = cursor.consume(open, CompilerErrorCode.UNEXPECTED_TOKEN,
                Messages.get("declaration.expectedToken", open.name(), describe(cursor.peek())));
        int depth = 1;
        while (depth > 0) {
            if (cursor.isAtEnd()) {
                throw new ContractParseError(CompilerErrorCode.UNEXPECTED_TOKEN,
                        Messages.get("declaration.unbalanced", start.text()), start);
            }
            Token token = cursor.advance();
            if (token.type() == open) depth++;
            else if (token.type() == close) depth--;
        }
    }

    /**
     * Skips to just after the next {@code ;}, or over the next balanced block.
     * Inside an aggregate a closing brace stops the skip without being consumed.
     */
    private void synchronize(boolean insideAggregate) {
        while (!cursor.isAtEnd()) {
            if (cursor.match(TokenType.SEMICOLON)) {
                return;
            }
            if (cursor.check(TokenType.RIGHT_BRACE)) {
                if (insideAggregate) return;
                cursor.advance();
                return;
            }
            if (cursor.check(TokenType.LEFT_BRACE)) {
                int depth = 0;
                do {
                    Token token = cursor.advance();
                    if (token.type() == TokenType.LEFT_BRACE) depth++;
                    else if (token.type() == TokenType.RIGHT_BRACE) depth--;
                } while (depth > 0 && !cursor.isAtEnd());
                return;
            }
            cursor.advance();
        }
    }

    private static String describe(Token token) {
        return token.type() == TokenType.END_OF_FILE ? "end of file" : token.text();
    }
}
