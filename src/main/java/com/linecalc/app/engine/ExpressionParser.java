package com.linecalc.app.engine;

import com.linecalc.app.exceptions.ParseException;
import com.linecalc.app.models.Token;
import com.linecalc.app.models.TokenKind;
import com.linecalc.app.models.Value;

import java.util.List;

/**
 * Operator-precedence parser that evaluates while it parses.
 *
 * Precedence, lowest first: comparison, additive, multiplicative, power.
 * Power is right-associative, everything else left-associative.
 * Comparisons evaluate to 1 (true) or 0 (false).
 *
 * A percent literal that is the immediate right operand of '+' or '-'
 * applies to the left operand: {@code 200 + 10%} is {@code 220}.
 * Anywhere else it is its plain fraction: {@code 200 * 10%} is {@code 20}.
 */
public class ExpressionParser {

    private static final int PREC_CMP = 5;
    private static final int PREC_ADD = 10;
    private static final int PREC_MUL = 20;
    private static final int PREC_POW = 30;

    // Bounds recursion through parentheses, unary signs, function calls and '^' chains
    static final int MAX_DEPTH = 500;

    private final List<Token> tokens;
    private final ReferenceResolver resolver;
    private int pos;
    private int depth;

    public ExpressionParser(List<Token> tokens, ReferenceResolver resolver) {
        this.tokens = tokens;
        this.resolver = resolver;
    }

    /**
     * Tokenizes and evaluates an expression. 'resolver' may be null,
     * in which case any reference is an error.
     */
    public static double evaluate(String expr, ReferenceResolver resolver) {
        return new ExpressionParser(Tokenizer.tokenize(expr), resolver).parse().getNumber();
    }

    /**
     * Parses the whole token stream; trailing tokens are an error.
     */
    public Value parse() {
        Value v = parseExpr(0);
        if (cur().getKind() != TokenKind.EOF) {
            throw new ParseException("unexpected token: " + cur().getText());
        }
        return v;
    }

    private Token cur() {
        if (pos >= tokens.size()) {
            return Token.eof();
        }
        return tokens.get(pos);
    }

    private void expect(TokenKind kind) {
        Token t = cur();
        if (t.getKind() != kind) {
            throw new ParseException("expected " + kind + ", got " + (t.getKind() == TokenKind.EOF ? "end of input" : t.getText()));
        }
        pos++;
    }

    private void enter() {
        if (++depth > MAX_DEPTH) {
            throw new ParseException("expression nested too deeply");
        }
    }

    private Value parseExpr(int minPrec) {
        enter();
        try {
            return parseInfix(minPrec);
        } finally {
            depth--;
        }
    }

    private Value parseInfix(int minPrec) {
        Value left = parsePrefix();

        while (true) {
            Token op = cur();
            int prec = infixPrec(op.getKind());
            if (prec < 0 || prec < minPrec) {
                break;
            }
            pos++;
            int nextMin = op.getKind() == TokenKind.POW ? prec : prec + 1;
            Value right = parseExpr(nextMin);
            left = apply(op, left, right);
        }
        return left;
    }

    private static int infixPrec(TokenKind kind) {
        switch (kind) {
            case PLUS:
            case MINUS:
                return PREC_ADD;
            case MUL:
            case DIV:
                return PREC_MUL;
            case POW:
                return PREC_POW;
            case GT:
            case LT:
            case GTE:
            case LTE:
            case EQ:
            case NE:
                return PREC_CMP;
            default:
                return -1;
        }
    }

    private static Value apply(Token op, Value left, Value right) {
        double l = left.getNumber();
        double r = right.getNumber();
        switch (op.getKind()) {
            case PLUS:
                return Value.of(right.isPercent() ? l * (1 + r) : l + r);
            case MINUS:
                return Value.of(right.isPercent() ? l * (1 - r) : l - r);
            case MUL:
                return Value.of(l * r);
            case DIV:
                return Value.of(l / r);
            case POW:
                return Value.of(Math.pow(l, r));
            case GT:
                return bool(l > r);
            case LT:
                return bool(l < r);
            case GTE:
                return bool(l >= r);
            case LTE:
                return bool(l <= r);
            case EQ:
                return bool(l == r);
            case NE:
                return bool(l != r);
            default:
                throw new ParseException("unexpected operator: " + op.getText());
        }
    }

    private static Value bool(boolean b) {
        return Value.of(b ? 1 : 0);
    }

    private Value parsePrefix() {
        enter();
        try {
            return parseOperand();
        } finally {
            depth--;
        }
    }

    private Value parseOperand() {
        Token t = cur();
        switch (t.getKind()) {
            case PLUS:
                pos++;
                return parsePrefix();
            case MINUS: {
                pos++;
                Value v = parsePrefix();
                return new Value(-v.getNumber(), v.isPercent());
            }
            case NUMBER:
                pos++;
                return new Value(t.getNumber(), t.isPercent());
            case REF:
                pos++;
                if (resolver == null) {
                    throw new ParseException("no resolver for reference " + t.getText());
                }
                return Value.of(resolver.resolve(t.getRef()));
            case IDENT: {
                pos++;
                expect(TokenKind.LPAREN);
                Value arg = parseExpr(0);
                expect(TokenKind.RPAREN);
                return Value.of(MathFunctions.call(t.getText(), arg.getNumber()));
            }
            case LPAREN: {
                pos++;
                Value v = parseExpr(0);
                expect(TokenKind.RPAREN);
                return v;
            }
            case EOF:
                throw new ParseException("missing operand");
            default:
                throw new ParseException("unexpected token: " + t.getText());
        }
    }
}
