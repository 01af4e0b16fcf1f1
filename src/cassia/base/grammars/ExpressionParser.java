package cassia.base.grammars;

import antlr.NoViableAltException;
import antlr.RecognitionException;
import antlr.Token;
import antlr.TokenStream;
import antlr.TokenStreamException;
import cassia.hir.ElementaryFunction;
import cassia.hir.ElementaryKind;
import cassia.hir.Expression;
import cassia.hir.ExpressionTooComplexException;
import cassia.hir.Factorial;
import cassia.hir.FunctionCall;
import cassia.hir.IntegerLiteral;
import cassia.hir.Literal;
import cassia.hir.Power;
import cassia.hir.Product;
import cassia.hir.Quotient;
import cassia.hir.Sum;
import cassia.hir.Symbolic;
import cassia.hir.Undefined;
import cassia.hir.Variable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
* Recursive-descent parser of the expression language:
* <pre>
* statement      : IDENT '(' IDENT (',' IDENT)* ')' '=' expression
*                | IDENT '=' expression
*                | expression
* expression     : multiplicative (('+'|'-') multiplicative)*
* multiplicative : unary (('*'|'/') unary | unary)*
* unary          : ('-'|'+') unary | power
* power          : postfix ('^' unary)?
* postfix        : primary '!'*
* primary        : NUMBER | IDENT ('(' arguments ')')? | '(' expression ')'
* </pre>
* A factor following another factor without an operator is multiplied by it.
* Identifiers followed by a parenthesis are calls only for elementary
* function names and the user function names given to the parser; any other
* identifier is a variable. The parser builds raw trees, which are not
* simplified. Input nesting deeper than the "max-depth" option is rejected
* with an {@link ExpressionTooComplexException}.
*/
public class ExpressionParser extends antlr.LLkParser implements ExpressionTokenTypes {

    // Names of the tokens in syntax error messages, indexed by token type.
    private static final String[] token_names = new String[ASSIGN + 1];

    static {
        token_names[Token.EOF_TYPE] = "end of input";
        token_names[NUMBER] = "number";
        token_names[IDENT] = "identifier";
        token_names[PLUS] = "'+'";
        token_names[MINUS] = "'-'";
        token_names[STAR] = "'*'";
        token_names[SLASH] = "'/'";
        token_names[CARET] = "'^'";
        token_names[BANG] = "'!'";
        token_names[LPAREN] = "'('";
        token_names[RPAREN] = "')'";
        token_names[COMMA] = "','";
        token_names[ASSIGN] = "'='";
    }

    private static final Literal one_half = Literal.valueOf(1, 2);

    private final Set<String> function_names;

    private final int max_depth;

    private int depth;

    public ExpressionParser(TokenStream lexer) {
        this(lexer, Collections.<String>emptySet());
    }

    /**
    * Constructs a parser that treats the given names as user functions.
    */
    public ExpressionParser(TokenStream lexer, Set<String> function_names) {
        super(lexer, 2);
        tokenNames = token_names;
        this.function_names = new HashSet<String>(function_names);
        this.max_depth = Symbolic.getMaxDepth();
        this.depth = 0;
    }

    /**
    * Parses a complete statement.
    */
    public ParsedStatement statement() throws RecognitionException, TokenStreamException {
        ParsedStatement ret;
        if (LA(1) == IDENT && LA(2) == ASSIGN) {
            String name = LT(1).getText();
            checkDefinable(LT(1));
            consume();
            match(ASSIGN);
            ret = new ParsedStatement(ParsedStatement.VARIABLE_DEFINITION, name,
                    Collections.<Variable>emptyList(), expression());
        } else if (LA(1) == IDENT && LA(2) == LPAREN && isFunctionDefinition()) {
            Token name_token = LT(1);
            String name = name_token.getText();
            checkDefinable(name_token);
            consume();
            match(LPAREN);
            List<Variable> params = new ArrayList<Variable>(4);
            params.add(parameter(name));
            while (LA(1) == COMMA) {
                consume();
                params.add(parameter(name));
            }
            match(RPAREN);
            match(ASSIGN);
            // The body may call the function being defined.
            function_names.add(name);
            ret = new ParsedStatement(ParsedStatement.FUNCTION_DEFINITION, name,
                    params, expression());
        } else {
            ret = new ParsedStatement(ParsedStatement.EXPRESSION, null,
                    Collections.<Variable>emptyList(), expression());
        }
        match(Token.EOF_TYPE);
        return ret;
    }

    /**
    * Parses a complete expression.
    */
    public Expression topExpression() throws RecognitionException, TokenStreamException {
        Expression ret = expression();
        match(Token.EOF_TYPE);
        return ret;
    }

    // Scans IDENT '(' IDENT (',' IDENT)* ')' '=' without consuming it.
    private boolean isFunctionDefinition() throws TokenStreamException {
        int i = 3;
        if (LA(i) != IDENT) {
            return false;
        }
        i++;
        while (LA(i) == COMMA && LA(i + 1) == IDENT) {
            i += 2;
        }
        return LA(i) == RPAREN && LA(i + 1) == ASSIGN;
    }

    private Variable parameter(String function_name)
            throws RecognitionException, TokenStreamException {
        Token t = LT(1);
        match(IDENT);
        if (t.getText().equals(function_name)) {
            throw new RecognitionException(function_name
                    + " cannot be a parameter of itself", getFilename(),
                    t.getLine(), t.getColumn());
        }
        return new Variable(t.getText());
    }

    // Names of built-in functions and values cannot be redefined.
    private void checkDefinable(Token t) throws RecognitionException {
        String name = t.getText();
        if (ElementaryKind.fromString(name) != null || name.equals("sqrt")
                || name.equals("Deriv") || name.equals("UNDEFINED")) {
            throw new RecognitionException("cannot redefine " + name,
                    getFilename(), t.getLine(), t.getColumn());
        }
    }

    /**
    * expression : multiplicative (('+'|'-') multiplicative)*
    */
    public Expression expression() throws RecognitionException, TokenStreamException {
        List<Expression> terms = new ArrayList<Expression>(4);
        terms.add(multiplicative());
        while (LA(1) == PLUS || LA(1) == MINUS) {
            if (LA(1) == PLUS) {
                consume();
                terms.add(multiplicative());
            } else {
                consume();
                terms.add(negated(multiplicative()));
            }
        }
        return (terms.size() == 1) ? terms.get(0) : new Sum(terms);
    }

    // multiplicative : unary (('*'|'/') unary | unary)*
    private Expression multiplicative() throws RecognitionException, TokenStreamException {
        List<Expression> factors = new ArrayList<Expression>(4);
        factors.add(unary());
        for (;;) {
            switch (LA(1)) {
            case STAR:
                consume();
                factors.add(unary());
                break;
            case SLASH:
                consume();
                Expression dividend = toProduct(factors);
                factors = new ArrayList<Expression>(4);
                factors.add(new Quotient(dividend, unary()));
                break;
            case NUMBER:
            case IDENT:
            case LPAREN:
                factors.add(unary());
                break;
            default:
                return toProduct(factors);
            }
        }
    }

    private static Expression toProduct(List<Expression> factors) {
        return (factors.size() == 1) ? factors.get(0) : new Product(factors);
    }

    // unary : ('-'|'+') unary | power
    // Every nested sub-expression passes through here, so the nesting limit
    // is checked once per level.
    private Expression unary() throws RecognitionException, TokenStreamException {
        if (++depth > max_depth) {
            throw new ExpressionTooComplexException(
                    "expression nests too deeply to parse", max_depth);
        }
        try {
            if (LA(1) == MINUS) {
                consume();
                return negated(unary());
            } else if (LA(1) == PLUS) {
                consume();
                return unary();
            }
            return power();
        } finally {
            depth--;
        }
    }

    private static Expression negated(Expression e) {
        if (e instanceof Literal) {
            return ((Literal)e).negate();
        }
        return new Product(IntegerLiteral.MINUS_ONE, e);
    }

    // power : postfix ('^' unary)?
    private Expression power() throws RecognitionException, TokenStreamException {
        Expression base = postfix();
        if (LA(1) == CARET) {
            consume();
            return new Power(base, unary());
        }
        return base;
    }

    // postfix : primary '!'*
    private Expression postfix() throws RecognitionException, TokenStreamException {
        Expression ret = primary();
        while (LA(1) == BANG) {
            consume();
            ret = new Factorial(ret);
        }
        return ret;
    }

    // primary : NUMBER | IDENT ('(' arguments ')')? | '(' expression ')'
    private Expression primary() throws RecognitionException, TokenStreamException {
        Token t = LT(1);
        switch (LA(1)) {
        case NUMBER:
            consume();
            return number(t);
        case IDENT:
            consume();
            return identifier(t);
        case LPAREN:
            consume();
            Expression ret = expression();
            match(RPAREN);
            return ret;
        default:
            throw new NoViableAltException(t, getFilename());
        }
    }

    // Decimal numbers are converted to exact rationals.
    private Expression number(Token t) throws RecognitionException {
        try {
            BigDecimal d = new BigDecimal(t.getText());
            if (d.scale() <= 0) {
                return Literal.valueOf(d.toBigIntegerExact());
            }
            return Literal.valueOf(d.unscaledValue(), BigInteger.TEN.pow(d.scale()));
        } catch(NumberFormatException e) {
            throw new RecognitionException("malformed number " + t.getText(),
                    getFilename(), t.getLine(), t.getColumn());
        }
    }

    private Expression identifier(Token t) throws RecognitionException, TokenStreamException {
        String name = t.getText();
        ElementaryKind kind = ElementaryKind.fromString(name);
        if (kind != null) {
            match(LPAREN);
            Expression arg = expression();
            match(RPAREN);
            return new ElementaryFunction(kind, arg);
        }
        if (name.equals("sqrt")) {
            match(LPAREN);
            Expression arg = expression();
            match(RPAREN);
            return new Power(arg, one_half);
        }
        if (name.equals("UNDEFINED")) {
            return Undefined.UNDEFINED;
        }
        if (name.equals("Deriv") && LA(1) == LPAREN) {
            consume();
            List<Expression> args = arguments();
            if (args.size() != 2 || !(args.get(1) instanceof Variable)) {
                throw new RecognitionException(
                        "Deriv takes an expression and a variable",
                        getFilename(), t.getLine(), t.getColumn());
            }
            return ElementaryFunction.derivativeMarker(args.get(0),
                                                       (Variable)args.get(1));
        }
        if (function_names.contains(name) && LA(1) == LPAREN) {
            consume();
            return FunctionCall.call(name, arguments());
        }
        return new Variable(name);
    }

    // arguments ')' ; the opening parenthesis is already consumed.
    private List<Expression> arguments() throws RecognitionException, TokenStreamException {
        List<Expression> args = new ArrayList<Expression>(4);
        args.add(expression());
        while (LA(1) == COMMA) {
            consume();
            args.add(expression());
        }
        match(RPAREN);
        return args;
    }

}
