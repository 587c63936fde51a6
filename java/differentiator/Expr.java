package differentiator;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.LinkedList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Immutable expression tree over the single free variable {@code x}.
 * Nodes are never mutated after construction, so derived trees freely share
 * subtrees of the tree they were derived from.
 */
public abstract sealed class Expr permits Expr.Const, Expr.Var, Expr.BinEx, Expr.Pow, Expr.CallEx {

    /**
     * evaluate this (sub)expression with the free variable bound to x
     * @param x
     * @return the complex value, possibly infinite or NaN at undefined points
     */
    public abstract Complex eval(Complex x);
    /**
     * builds a new tree for the derivative of this (sub)expression with respect to x;
     * no simplification is done
     * @return
     */
    public abstract Expr derive();
    /**
     * puts a String representation of this expression as a formula on the stream
     * @param stream
     */
    public abstract void replicateTo(PrintStream stream);

    public static final class Const extends Expr {
        final double value;
        public Const(double val){
            value=val;
        }
        @Override
        public Complex eval(Complex x) {
            return Complex.ofReal(value);
        }
        @Override
        public Expr derive() {
            return new Const(0);
        }
        @Override
        public void replicateTo(PrintStream stream) {
            stream.print(this);
        }
        @Override
        public String toString() {
            String s = value == Math.rint(value) && Math.abs(value) < 1e15
                ? Long.toString((long) value)
                : Double.toString(value);
            return value < 0 ? "(" + s + ")" : s;
        }
    }
    public static final class Var extends Expr {
        public static final Var X = new Var();
        private Var(){}
        @Override
        public Complex eval(Complex x) {
            return x;
        }
        @Override
        public Expr derive() {
            return new Const(1);
        }
        @Override
        public void replicateTo(PrintStream stream) {
            stream.print("x");
        }
        @Override
        public String toString() {
            return "x";
        }
    }
    public static final class BinEx extends Expr {
        public enum Op {
            ADD('+'), SUB('-'), MUL('*'), DIV('/');
            final char symbol;
            Op(char symbol){
                this.symbol=symbol;
            }
            Complex apply(Complex a, Complex b) {
                return switch (this) {
                    case ADD -> a.add(b);
                    case SUB -> a.subtract(b);
                    case MUL -> a.multiply(b);
                    case DIV -> a.divide(b);
                };
            }
            public static Op of(char symbol) {
                for (var op:values()) {
                    if (op.symbol==symbol) return op;
                }
                throw new IllegalArgumentException("unknown operator '"+symbol+"'");
            }
        }
        final Expr l,r;
        final Op op;
        public BinEx(Expr l,Op op,Expr r) {
            this.l=Objects.requireNonNull(l);
            this.op=Objects.requireNonNull(op);
            this.r=Objects.requireNonNull(r);
        }
        @Override
        public Complex eval(Complex x) {
            return op.apply(l.eval(x), r.eval(x));
        }
        @Override
        public Expr derive() {
            switch (op) {
                // (f +- g)' = f' +- g'
                case ADD:
                case SUB:
                    return new BinEx(l.derive(),op,r.derive());
                // (f * g)' = f'*g + f*g'
                case MUL:
                    return new BinEx(
                        new BinEx(l.derive(),Op.MUL,r),
                        Op.ADD,
                        new BinEx(l,Op.MUL,r.derive()));
                // (f / g)' = (f'*g - f*g') / g^2
                case DIV:
                    var num = new BinEx(
                        new BinEx(l.derive(),Op.MUL,r),
                        Op.SUB,
                        new BinEx(l,Op.MUL,r.derive()));
                    return new BinEx(num,Op.DIV,new Pow(r,new Const(2)));
                default:
                    throw new IllegalStateException("no derivation rule for operator "+op);
            }
        }
        @Override
        public void replicateTo(PrintStream stream) {
            stream.print("(");
            l.replicateTo(stream);
            stream.print(op.symbol);
            r.replicateTo(stream);
            stream.print(")");
        }
        @Override
        public String toString() {
            return "("+l+" "+op.symbol+" "+r+")";
        }
    }
    public static final class Pow extends Expr {
        final Expr base,exponent;
        public Pow(Expr base,Expr exponent) {
            this.base=Objects.requireNonNull(base);
            this.exponent=Objects.requireNonNull(exponent);
        }
        @Override
        public Complex eval(Complex x) {
            return base.eval(x).pow(exponent.eval(x));
        }
        /**
         * general power rule d(u^v) = u^v * (v'*log(u) + v*(u'/u)), used for constant
         * exponents and constant bases alike
         */
        @Override
        public Expr derive() {
            var u = base;
            var v = exponent;
            var logTerm = new BinEx(v.derive(),BinEx.Op.MUL,new CallEx(CallEx.Func.LOG,u));
            var ratioTerm = new BinEx(v,BinEx.Op.MUL,new BinEx(u.derive(),BinEx.Op.DIV,u));
            return new BinEx(new Pow(u,v),BinEx.Op.MUL,new BinEx(logTerm,BinEx.Op.ADD,ratioTerm));
        }
        @Override
        public void replicateTo(PrintStream stream) {
            stream.print("(");
            base.replicateTo(stream);
            stream.print("^");
            exponent.replicateTo(stream);
            stream.print(")");
        }
        @Override
        public String toString() {
            return "("+base+" ^ "+exponent+")";
        }
    }
    public static final class CallEx extends Expr {
        public enum Func {
            SIN, COS, TAN, COT, LOG;
            public String functionName() {
                return name().toLowerCase(Locale.ROOT);
            }
            Complex apply(Complex z) {
                return switch (this) {
                    case SIN -> z.sin();
                    case COS -> z.cos();
                    case TAN -> z.tan();
                    case COT -> z.cot();
                    case LOG -> z.log();
                };
            }
            public static Optional<Func> lookup(String name) {
                return Arrays.stream(values())
                    .filter(f->f.functionName().equals(name))
                    .findFirst();
            }
        }
        final Func func;
        final Expr arg;
        public CallEx(Func func, Expr arg){
            this.func=Objects.requireNonNull(func);
            this.arg=Objects.requireNonNull(arg);
        }
        public CallEx(String name, Expr arg){
            this(Func.lookup(name).orElseThrow(() -> new IllegalArgumentException("unknown function '"+name+"'")),arg);
        }
        @Override
        public Complex eval(Complex x) {
            return func.apply(arg.eval(x));
        }
        /**
         * chain rule: f(g)' = f'(g) * g'
         */
        @Override
        public Expr derive() {
            Expr outer = switch (func) {
                case SIN -> new CallEx(Func.COS,arg);
                case COS -> new BinEx(new Const(-1),BinEx.Op.MUL,new CallEx(Func.SIN,arg));
                case TAN -> new BinEx(new Const(1),BinEx.Op.DIV,new Pow(new CallEx(Func.COS,arg),new Const(2)));
                case COT -> new BinEx(new Const(-1),BinEx.Op.MUL,
                    new BinEx(new Const(1),BinEx.Op.DIV,new Pow(new CallEx(Func.SIN,arg),new Const(2))));
                case LOG -> new BinEx(new Const(1),BinEx.Op.DIV,arg);
            };
            return new BinEx(outer,BinEx.Op.MUL,arg.derive());
        }
        @Override
        public void replicateTo(PrintStream stream) {
            stream.print(func.functionName());
            stream.print("(");
            arg.replicateTo(stream);
            stream.print(")");
        }
        @Override
        public String toString() {
            return func.functionName()+"("+arg+")";
        }
    }

    public static Expr parse(String expression) throws Parser.SyntaxError {
        var tokenstream = scan(expression);
        // we sort out all the pesky whitespaces
        tokenstream = tokenstream.stream()
            .filter(c->c.type()!=TokenType.WHITESPACE)
            .collect(Collectors.toCollection(LinkedList::new));
        // hand over the token stream to the parser
        var p = new Parser(tokenstream);
        // return a java object representation of the syntactic structure of the expression
        return p.parse();
    }
    /**
     * Iteratively decapitate the input string, matching the current start of the string with the patterns
     * for the respective tokens of the expression language.
     * @param expression
     * @return the input expression converted to a List of classified tokens, terminated by EOF
     */
    public static List<Token> scan(String expression){
        var tokenstream = new LinkedList<Token>();
        var position = 0;
        // repeat process as long as there is input to be scanned
        scanning: while (expression.length()>0){
            // iterate through all token types
            for (var tok:TokenType.values()) {
                if (tok==TokenType.EOF) continue;
                var matchy = tok.getPattern().matcher(expression);
                if (matchy.find()){ // input matched the pattern for this token type
                    var lex=matchy.group();
                    tokenstream.add(new Token(tok,lex,position));
                    // split off the found token from the input and continue scanning
                    expression=expression.substring(lex.length());
                    position+=lex.length();
                    continue scanning;
                }
            }
            throw new IllegalStateException("no token matches input at position "+position);
        }
        tokenstream.add(new Token(TokenType.EOF,"",position));
        return tokenstream;
    }

    /**
     * specifies TokenTypes for the expression language, together with their lexicographic pattern;
     * patterns are tried in declaration order
     */
    public static enum TokenType {
        NUMBER("\\d+(\\.\\d+)?","a constant"),
        NAME("[A-Za-z]+","a name"),
        ADDOP("(\\+|-)","+ or -"),
        MULOP("(\\*|/)","* or /"),
        POWOP("\\^","^"),
        LBRACK("\\(","'('"),
        RBRACK("\\)","')'"),
        WHITESPACE("\\s+","whitespace"),
        CATCHALL("(?s).","any character"),
        EOF("","end of input");
        private Pattern pattern;
        final String symbol;
        TokenType(String pattern,String symbol){
            this.pattern=Pattern.compile("\\A"+pattern);
            this.symbol=symbol;
        }
        /**
         * @return regex pattern that matches tokens of this type
         */
        public Pattern getPattern(){
            return pattern;
        }
    }
    /**
     * represents a classified input substring starting at position
     * - is generated by the scanner
     * - is consumed by the parser
     */
    public record Token(TokenType type,String input,int position) {
        String describe() {
            return type==TokenType.EOF ? "end of input" : "'"+input+"'";
        }
    };

    /**
     * Recursive Descent Parser for the expression language
     *
     */
    public static class Parser {
        /**
         * the input does not match the grammar; no partial tree is available
         */
        public static class SyntaxError extends Exception {
            private final int position;
            public SyntaxError(String message,int position){
                super(message+" at position "+position);
                this.position=position;
            }
            /**
             * @return 0-based offset of the offending token in the source
             */
            public int getPosition() {
                return position;
            }
        }
        private List<Token> terminals;
        /**
         * consumes (i.e. removes) whatever token is the current head of the input
         * @return
         */
        public Token consume(){
            return terminals.remove(0);
        }
        /**
         * consumes (i.e. removes) token from the rest of the input stream
         * @param t the expected token to be found at the head of the input
         * @param what describes the construct that needs the token
         * @return
         * @throws SyntaxError
         */
        public Token consume(TokenType t,String what) throws SyntaxError {
            var head = terminals.get(0);
            if (head.type()!=t) {
                if (head.type()==TokenType.EOF)
                    throw new SyntaxError("end of input while expecting "+t.symbol+" for "+what,head.position());
                throw new SyntaxError("expected "+t.symbol+" for "+what+", but found "+head.describe(),head.position());
            }
            return consume();
        }
        /**
         * check what the head of the remaining input looks like
         * @return head of the remaining input
         */
        public TokenType peek(){
            return terminals.get(0).type();
        }
        /**
         * Handover of the Tokenlist to the parser engine
         * @param terminals EOF terminated, mutable token list
         */
        public Parser(List<Token> terminals){
            this.terminals=terminals;
        }
        /**
         * Entry function into parsing: a complete expression followed by the end of input
         * @return
         * @throws SyntaxError
         */
        public Expr parse() throws SyntaxError {
            var e = e();
            if (peek()!=TokenType.EOF) {
                var t = terminals.get(0);
                throw new SyntaxError("unexpected trailing input "+t.describe(),t.position());
            }
            return e;
        }
// E  -> T E'
// E' -> + T E' | -TE' |epsilon
        /**
         * D&C handle the parsing of an expression
         * @return
         * @throws SyntaxError
         */
        private Expr e() throws SyntaxError {
            var e = t();
            while ((peek())==TokenType.ADDOP){
                var t = consume();
                var e2 = t();
                e = new BinEx(e,BinEx.Op.of(t.input().charAt(0)),e2);
            }
            return e;
        }
// T  -> F T'
// T' -> * F T' | /FT' |epsilon
        /**
         * D&C handling of the parsing of a multiplicative term
         * @return
         * @throws SyntaxError
         */
        private Expr t() throws SyntaxError {
            var e = f();
            while ((peek())==TokenType.MULOP){
                var t = consume();
                var e2 = f();
                e = new BinEx(e,BinEx.Op.of(t.input().charAt(0)),e2);
            }
            return e;
        }
// F  -> B ^ F | B
        /**
         * D&C handling of the parsing of a power; the exponent is a full factor, so ^ is right associative
         * @return
         * @throws SyntaxError
         */
        private Expr f() throws SyntaxError {
            var b = b();
            if (peek()==TokenType.POWOP) {
                consume();
                return new Pow(b,f());
            }
            return b;
        }
// B  -> (E) | number | x | C
        private Expr b() throws SyntaxError {
            switch (peek()){
                case NUMBER: return NUMBER();
                case NAME: return c();
                case LBRACK:
                    consume();
                    var e = e();
                    consume(TokenType.RBRACK,"sub-expression");
                    return e;
                default:
                    var t = terminals.get(0);
                    throw new SyntaxError("expected a constant, x, a function call or ( but found "+t.describe(),t.position());
            }
        }
// C -> x | name ( E )
        private Expr c() throws SyntaxError {
            var t = consume();
            var name = t.input();
            if (name.equals("x")) return Var.X;
            var func = CallEx.Func.lookup(name);
            if (func.isEmpty()) throw new SyntaxError("unknown identifier '"+name+"'",t.position());
            if (peek()!=TokenType.LBRACK) {
                throw new SyntaxError("function '"+name+"' must be followed by (",terminals.get(0).position());
            }
            consume();
            var arg = e();
            consume(TokenType.RBRACK,"call of "+name);
            return new CallEx(func.get(),arg);
        }
        private Expr NUMBER() {
            return new Const(Double.parseDouble(consume().input()));
        }
    }
}
