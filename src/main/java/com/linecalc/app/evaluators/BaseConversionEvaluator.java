package com.linecalc.app.evaluators;

import com.linecalc.app.exceptions.DomainException;

import java.math.BigInteger;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Integer base conversion: "255 in hex", "0xff in dec", "0b1010 in octal".
 * Decimal results keep their numeric value for later references.
 */
public class BaseConversionEvaluator extends HandlerChainEvaluator {

    private static final Pattern CONVERSION = Pattern.compile(
            "^(0x[0-9a-f]+|0b[01]+|0o[0-7]+|\\d+)\\s+(?:in|to)\\s+(dec|decimal|hex|hexadecimal|oct|octal|bin|binary)$");

    private final List<Handler> chain = List.of(this::convert);

    public BaseConversionEvaluator() {
        super("base-conversion");
    }

    @Override
    protected List<Handler> handlers() {
        return chain;
    }

    @Override
    public boolean accepts(String expr) {
        return CONVERSION.matcher(expr.trim().toLowerCase(Locale.ROOT)).matches();
    }

    HandlerResult convert(String expr, String lower) {
        Matcher m = CONVERSION.matcher(lower);
        if (!m.matches()) {
            return HandlerResult.notMine();
        }
        BigInteger n = parse(m.group(1));
        switch (m.group(2)) {
            case "hex":
            case "hexadecimal":
                return HandlerResult.claimed("0x" + n.toString(16).toUpperCase(Locale.ROOT));
            case "oct":
            case "octal":
                return HandlerResult.claimed("0o" + n.toString(8));
            case "bin":
            case "binary":
                return HandlerResult.claimed("0b" + n.toString(2));
            default:
                return HandlerResult.claimed(n.toString(), n.doubleValue());
        }
    }

    static BigInteger parse(String literal) {
        try {
            if (literal.startsWith("0x")) {
                return new BigInteger(literal.substring(2), 16);
            }
            if (literal.startsWith("0b")) {
                return new BigInteger(literal.substring(2), 2);
            }
            if (literal.startsWith("0o")) {
                return new BigInteger(literal.substring(2), 8);
            }
            return new BigInteger(literal);
        } catch (NumberFormatException e) {
            throw new DomainException("not an integer: " + literal);
        }
    }
}
