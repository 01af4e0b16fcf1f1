package cassia.base.grammars;

/**
* Token types shared by {@link ExpressionLexer} and {@link ExpressionParser}.
* End of input is {@link antlr.Token#EOF_TYPE}; the types below start at the
* first value the antlr runtime leaves to users.
*/
public interface ExpressionTokenTypes {
    int NUMBER = antlr.Token.MIN_USER_TYPE;
    int IDENT = NUMBER + 1;
    int PLUS = NUMBER + 2;
    int MINUS = NUMBER + 3;
    int STAR = NUMBER + 4;
    int SLASH = NUMBER + 5;
    int CARET = NUMBER + 6;
    int BANG = NUMBER + 7;
    int LPAREN = NUMBER + 8;
    int RPAREN = NUMBER + 9;
    int COMMA = NUMBER + 10;
    int ASSIGN = NUMBER + 11;
}
