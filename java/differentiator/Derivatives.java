package differentiator;

import java.util.function.Function;

/**
 * A parsed function together with its first and second derivative trees.
 * Each tree is built once; the evaluators returned by {@link #f()}, {@link #f1()} and
 * {@link #f2()} only walk them.
 */
public record Derivatives(Expr function, Expr first, Expr second) {

    /**
     * parses the source once and derives it twice
     * @param source expression over x
     * @return
     * @throws Expr.Parser.SyntaxError if source does not match the grammar
     */
    public static Derivatives differentiate(String source) throws Expr.Parser.SyntaxError {
        var original = Expr.parse(source);
        var first = original.derive();
        var second = first.derive();
        return new Derivatives(original, first, second);
    }

    public Function<Complex, Complex> f() {
        return evaluator(function);
    }

    public Function<Complex, Complex> f1() {
        return evaluator(first);
    }

    public Function<Complex, Complex> f2() {
        return evaluator(second);
    }

    /**
     * @param order 0 for the function itself, 1 or 2 for its derivatives
     * @return the tree of the requested order
     */
    public Expr tree(int order) {
        switch (order) {
            case 0: return function;
            case 1: return first;
            case 2: return second;
            default: throw new IllegalArgumentException("no derivative of order " + order);
        }
    }

    private static Function<Complex, Complex> evaluator(Expr tree) {
        return tree::eval;
    }
}
