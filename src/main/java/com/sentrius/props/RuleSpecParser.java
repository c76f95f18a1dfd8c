package com.sentrius.props;

import com.sentrius.props.model.NamedRule;
import org.antlr.v4.runtime.*;

public class RuleSpecParser {

    public static NamedRule parse(String notation) throws RuleParseException {
        if (notation == null) {
            throw new RuleParseException(null, "Rule notation cannot be null", null);
        }

        try {
            CharStream charStream = CharStreams.fromString(notation);
            RuleNotationLexer lexer = new RuleNotationLexer(charStream);
            lexer.removeErrorListeners();
            lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

            CommonTokenStream tokens = new CommonTokenStream(lexer);
            RuleNotationParser parser = new RuleNotationParser(tokens);
            parser.removeErrorListeners();
            parser.addErrorListener(ThrowingErrorListener.INSTANCE);

            RuleNotationParser.NotationContext notationContext = parser.notation();

            RuleSpecVisitor visitor = new RuleSpecVisitor();
            return visitor.visitNotation(notationContext);
        } catch (RuntimeException e) {
            throw new RuleParseException(notation,
                "Failed to parse rule '" + notation + "': " + e.getMessage(), e);
        }
    }

    private static class ThrowingErrorListener extends BaseErrorListener {
        public static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                              int line, int charPositionInLine, String msg, RecognitionException e) {
            throw new IllegalArgumentException("Syntax error at position " + charPositionInLine + " - " + msg);
        }
    }
}
