package org.axion.math.dsl;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.IntervalSet;
import org.axion.math.dsl.antlr.AxionAstBuilder;
import org.axion.math.dsl.antlr.AxionLexer;
import org.axion.math.dsl.antlr.AxionParser;

import java.util.Objects;

/**
 * Expression parser using the ANTLR-generated lexer and parser.
 *
 * This is the single entry point through which text becomes an
 * {@link Expression}. The whole input must form one expression: the first
 * syntax error aborts the parse with an {@link ExpressionParseException},
 * nothing is recovered or partially returned.
 *
 * Examples:
 * - x^2 + 3*x
 * - ∀x: x = x
 * - ∀m, n ∈ ℕ: S(m) = S(n) ⟹ m = n
 */
public final class ExpressionParser {

    private ExpressionParser() {
        // Static utility class
    }

    /**
     * Parses a mathematical statement or term.
     *
     * @param text The source text
     * @return The parsed expression tree
     * @throws ExpressionParseException if the text is not a well-formed expression
     */
    public static Expression parse(String text) {
        Objects.requireNonNull(text, "Expression text cannot be null");
        ErrorListener errors = new ErrorListener(text);

        AxionLexer lexer = new AxionLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        AxionParser parser = new AxionParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(errors);

        AxionParser.StatementContext tree = parser.statement();
        return new AxionAstBuilder().visit(tree);
    }

    /**
     * Error listener that converts ANTLR errors to ExpressionParseException.
     */
    private static final class ErrorListener extends BaseErrorListener {

        private final String source;

        ErrorListener(String source) {
            this.source = source;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                int line, int charPositionInLine, String msg,
                RecognitionException e) {
            if (offendingSymbol instanceof Token token) {
                int position = token.getType() == Token.EOF ? source.length() : token.getStartIndex();
                String found = token.getType() == Token.EOF ? "end of input" : "'" + token.getText() + "'";
                throw new ExpressionParseException(position, expected(recognizer, e), found);
            }
            if (recognizer instanceof Lexer lexer) {
                int position = lexer._tokenStartCharIndex;
                String found = position < source.length()
                        ? "'" + source.charAt(position) + "'"
                        : "end of input";
                throw new ExpressionParseException(position, "a valid symbol", found);
            }
            throw new ExpressionParseException(charPositionInLine, "valid input", msg);
        }

        private static String expected(Recognizer<?, ?> recognizer, RecognitionException e) {
            IntervalSet expected = null;
            if (e != null && e.getExpectedTokens() != null) {
                expected = e.getExpectedTokens();
            } else if (recognizer instanceof Parser parser) {
                expected = parser.getExpectedTokens();
            }
            if (expected == null || expected.isNil()) {
                return "end of input";
            }
            return expected.toString(recognizer.getVocabulary());
        }
    }
}
