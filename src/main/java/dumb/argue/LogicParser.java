package dumb.argue;

import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads programs of the form
 * <pre>
 * sunny, stay_home.
 * happy :- stay_home.
 * ~happy :- sunny, stay_home.   % comment to end of line
 * </pre>
 * into un-interned {@link Clause} and {@link Rule} instances, in source order.
 */
public class LogicParser {
    private static final int CONTEXT_BUFFER_SIZE = 50;
    private static final char TERMINATOR = '.';
    private static final char SEPARATOR = ',';
    private static final char NEGATION = '~';
    private static final char COMMENT = '%';

    private final Reader reader;
    private final StringBuilder contextBuffer = new StringBuilder(CONTEXT_BUFFER_SIZE);
    private int currentChar = -2;
    private int line = 1;
    private int col = 0;

    private LogicParser(Reader reader) {
        this.reader = reader;
    }

    public static List<Statement> parse(String program) throws ParseException {
        try (var reader = new StringReader(program)) {
            var parser = new LogicParser(reader);
            var statements = new ArrayList<Statement>();
            parser.skipWhitespaceAndComments();
            while (parser.peek() != -1) {
                statements.add(parser.parseStatement());
                parser.skipWhitespaceAndComments();
            }
            return statements;
        } catch (IOException e) {
            throw new ParseException("IO Error: " + e.getMessage());
        }
    }

    private static boolean isAtomStart(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isAtomPart(int c) {
        return isAtomStart(c) || (c >= '0' && c <= '9') || c == '_';
    }

    private static String describe(int c) {
        return c == -1 ? "EOF" : "'" + (char) c + "'";
    }

    private int peek() throws IOException {
        if (currentChar == -2) {
            currentChar = reader.read();
            if (contextBuffer.length() >= CONTEXT_BUFFER_SIZE) {
                contextBuffer.deleteCharAt(0);
            }
            if (currentChar != -1) {
                contextBuffer.append((char) currentChar);
            }
        }
        return currentChar;
    }

    private int consumeChar() throws IOException {
        var c = peek();
        if (c != -1) {
            currentChar = -2;
            if (c == '\n') {
                line++;
                col = 0;
            } else {
                col++;
            }
        }
        return c;
    }

    private void consumeChar(char expected) throws IOException, ParseException {
        var actual = consumeChar();
        if (actual != expected) {
            throw createParseException("Expected '" + expected + "'", describe(actual));
        }
    }

    private void skipWhitespaceAndComments() throws IOException {
        while (true) {
            var c = peek();
            if (c == -1) return;
            if (Character.isWhitespace(c)) {
                consumeChar();
            } else if (c == COMMENT) {
                consumeChar();
                while (peek() != '\n' && peek() != -1) {
                    consumeChar();
                }
            } else {
                return;
            }
        }
    }

    private Statement parseStatement() throws IOException, ParseException {
        skipWhitespaceAndComments();
        var c = peek();
        if (c == TERMINATOR) throw createParseException("Empty statement");
        if (c == ':') throw createParseException("Rule has no head literal");

        var first = parseLiteral();
        skipWhitespaceAndComments();
        if (peek() == ':') {
            consumeChar(':');
            consumeChar('-');
            skipWhitespaceAndComments();
            if (peek() == TERMINATOR) throw createParseException("Rule for " + first.key() + " has no body literals");
            var body = parseLiteralList(new LinkedHashSet<>());
            expectTerminator();
            return new Rule(first, body);
        }

        var literals = new LinkedHashSet<Literal>();
        literals.add(first);
        if (peek() == SEPARATOR) {
            consumeChar(SEPARATOR);
            parseLiteralList(literals);
        }
        expectTerminator();
        return new Clause(literals);
    }

    private Set<Literal> parseLiteralList(Set<Literal> literals) throws IOException, ParseException {
        skipWhitespaceAndComments();
        literals.add(parseLiteral());
        skipWhitespaceAndComments();
        while (peek() == SEPARATOR) {
            consumeChar(SEPARATOR);
            skipWhitespaceAndComments();
            literals.add(parseLiteral());
            skipWhitespaceAndComments();
        }
        return literals;
    }

    private void expectTerminator() throws IOException, ParseException {
        skipWhitespaceAndComments();
        var c = peek();
        if (c == -1) throw createParseException("Unterminated statement: expected '" + TERMINATOR + "'", "EOF");
        if (c != TERMINATOR)
            throw createParseException("Expected '" + SEPARATOR + "' or '" + TERMINATOR + "'", describe(c));
        consumeChar(TERMINATOR);
    }

    private Literal parseLiteral() throws IOException, ParseException {
        var positive = true;
        if (peek() == NEGATION) {
            consumeChar(NEGATION);
            skipWhitespaceAndComments();
            positive = false;
        }
        var c = peek();
        if (c == -1) throw createParseException("Unterminated statement: expected literal", "EOF");
        if (!isAtomStart(c)) throw createParseException("Expected literal", describe(c));
        var sb = new StringBuilder();
        while (isAtomPart(peek())) {
            sb.append((char) consumeChar());
        }
        return new Literal(sb.toString(), positive);
    }

    private ParseException createParseException(String message) {
        return new ParseException(message, line, col, contextBuffer.toString());
    }

    private ParseException createParseException(String message, @Nullable String foundToken) {
        var foundInfo = foundToken != null ? " found " + foundToken : "";
        return new ParseException(message + foundInfo, line, col, contextBuffer.toString());
    }

    public static class ParseException extends Exception {
        private final int line;
        private final int col;
        private final String context;

        public ParseException(String message) {
            this(message, -1, -1, "");
        }

        public ParseException(String message, int line, int col, String context) {
            super(message);
            this.line = line;
            this.col = col;
            this.context = context;
        }

        public int line() {
            return line;
        }

        public int col() {
            return col;
        }

        @Override
        public String getMessage() {
            var location = (line != -1 && col != -1) ? " at line " + line + ", col " + col : "";
            var contextSnippet = context != null && !context.isEmpty() ? " near '" + context + "'" : "";
            return super.getMessage() + location + contextSnippet;
        }
    }
}
