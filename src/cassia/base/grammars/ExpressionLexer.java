package cassia.base.grammars;

import antlr.CommonToken;
import antlr.RecognitionException;
import antlr.Token;
import antlr.TokenStream;
import antlr.TokenStreamException;
import antlr.TokenStreamRecognitionException;

/**
* Splits one line of input into tokens. Numbers are runs of digits with an
* optional fraction part; identifiers start with a letter and continue with
* letters and digits. Lines and columns are counted from one.
*/
public class ExpressionLexer implements TokenStream, ExpressionTokenTypes {

    private final String text;

    private final String filename;

    private int pos;

    private int line;

    private int column;

    public ExpressionLexer(String text) {
        this(text, null);
    }

    /**
    * Constructs a lexer over the given text.
    * @param text the input.
    * @param filename the name reported in error messages, or null.
    */
    public ExpressionLexer(String text, String filename) {
        this.text = text;
        this.filename = filename;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    public Token nextToken() throws TokenStreamException {
        skipWhitespace();
        if (pos >= text.length()) {
            return makeToken(Token.EOF_TYPE, "<EOF>", line, column);
        }
        int start_line = line, start_column = column;
        char c = text.charAt(pos);
        if (Character.isDigit(c)) {
            return makeToken(NUMBER, readNumber(), start_line, start_column);
        }
        if (Character.isLetter(c)) {
            int start = pos;
            while (pos < text.length() && Character.isLetterOrDigit(text.charAt(pos))) {
                advance();
            }
            return makeToken(IDENT, text.substring(start, pos), start_line, start_column);
        }
        int type;
        switch (c) {
        case '+': type = PLUS; break;
        case '-': type = MINUS; break;
        case '*': type = STAR; break;
        case '/': type = SLASH; break;
        case '^': type = CARET; break;
        case '!': type = BANG; break;
        case '(': type = LPAREN; break;
        case ')': type = RPAREN; break;
        case ',': type = COMMA; break;
        case '=': type = ASSIGN; break;
        default:
            throw new TokenStreamRecognitionException(new RecognitionException(
                    "unexpected character '" + c + "'", filename,
                    start_line, start_column));
        }
        advance();
        return makeToken(type, String.valueOf(c), start_line, start_column);
    }

    // digits ('.' digits?)?
    private String readNumber() {
        int start = pos;
        while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
            advance();
        }
        if (pos < text.length() && text.charAt(pos) == '.') {
            advance();
            while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                advance();
            }
        }
        return text.substring(start, pos);
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            advance();
        }
    }

    private void advance() {
        if (text.charAt(pos) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        pos++;
    }

    private static Token makeToken(int type, String s, int line, int column) {
        CommonToken t = new CommonToken(type, s);
        t.setLine(line);
        t.setColumn(column);
        return t;
    }

}
