package differentiator;

import static differentiator.ComplexAssertions.assertClose;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import java.util.stream.Collectors;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import differentiator.Expr.BinEx;
import differentiator.Expr.CallEx;
import differentiator.Expr.Const;
import differentiator.Expr.Parser.SyntaxError;
import differentiator.Expr.Pow;
import differentiator.Expr.TokenType;
import differentiator.Expr.Var;

@DisplayName("Scanner and parser")
class ExprParserTest {

    @Nested
    @DisplayName("Scanner")
    class Scanner {

        @Test
        void classifiesTokensAndRecordsPositions() {
            var tokens = Expr.scan("2.5 * sin(x)");

            assertThat(tokens.stream().map(Expr.Token::type).collect(Collectors.toList()))
                .containsExactly(TokenType.NUMBER, TokenType.WHITESPACE, TokenType.MULOP, TokenType.WHITESPACE,
                    TokenType.NAME, TokenType.LBRACK, TokenType.NAME, TokenType.RBRACK, TokenType.EOF);
            assertThat(tokens.get(0).input()).isEqualTo("2.5");
            assertThat(tokens.get(4).position()).isEqualTo(6);
            assertThat(tokens.get(tokens.size() - 1).position()).isEqualTo(12);
        }

        @Test
        void identifiersAreMaximalLetterRuns() {
            var tokens = Expr.scan("sinx");
            assertThat(tokens.get(0).input()).isEqualTo("sinx");
        }

        @Test
        void unknownCharactersBecomeCatchAllTokens() {
            var tokens = Expr.scan("x % 2");
            assertThat(tokens.get(2).type()).isEqualTo(TokenType.CATCHALL);
        }
    }

    @Nested
    @DisplayName("Precedence and associativity")
    class Precedence {

        @ParameterizedTest(name = "{0} = {1}")
        @CsvSource({
            "2+3*4, 14",
            "(2+3)*4, 20",
            "1-2-3, -4",
            "8/4/2, 1",
            "2^3^2, 512",
            "2*3^2, 18",
            "  7 -   2.5 ,  4.5",
            "log(1) + cos(0), 1"
        })
        void constantExpressionsEvaluate(String source, double expected) throws SyntaxError {
            assertClose(Expr.parse(source).eval(Complex.ZERO), expected, 0);
        }

        @Test
        void powerIsRightAssociative() throws SyntaxError {
            var e = Expr.parse("x^x^x");

            assertThat(e).isInstanceOf(Pow.class);
            var pow = (Pow) e;
            assertThat(pow.base).isSameAs(Var.X);
            assertThat(pow.exponent).isInstanceOf(Pow.class);
        }

        @Test
        void additionFoldsToTheLeft() throws SyntaxError {
            var e = (BinEx) Expr.parse("x - 1 + 2");

            assertThat(e.op).isEqualTo(BinEx.Op.ADD);
            assertThat(((BinEx) e.l).op).isEqualTo(BinEx.Op.SUB);
        }

        @Test
        void functionCallsTakeAFullExpression() throws SyntaxError {
            var e = (CallEx) Expr.parse("cot ( x * 2 + 1 )");

            assertThat(e.func).isEqualTo(CallEx.Func.COT);
            assertThat(e.arg).isInstanceOf(BinEx.class);
        }

        @Test
        void variableEvaluatesToItsInput() throws SyntaxError {
            var z = new Complex(1.5, -2);
            assertThat(Expr.parse("x").eval(z)).isSameAs(z);
        }
    }

    @Nested
    @DisplayName("Syntax errors")
    class Errors {

        @ParameterizedTest
        @ValueSource(strings = {"x +", "sin(x", "2x", "", "(x", "x)", "1.2.3", "1.", ".5", "foo(x)",
            "sin x", "sin", "x(2)", "* x", "x ^", "2 $ 3", "sin()", "X"})
        void malformedInputIsRejected(String source) {
            assertThatThrownBy(() -> Expr.parse(source)).isInstanceOf(SyntaxError.class);
        }

        @ParameterizedTest(name = "{0} fails at {1}")
        @CsvSource(delimiter = '|', value = {
            "2x       | 1",
            "x +      | 3",
            "sin(x    | 5",
            "1.2.3    | 3",
            "foo(x)   | 0",
            "(x + 1   | 6",
            "x(2)     | 1"
        })
        void errorsReportTheOffendingPosition(String source, int position) {
            var error = catchThrowableOfType(() -> Expr.parse(source), SyntaxError.class);

            assertThat(error.getPosition()).isEqualTo(position);
            assertThat(error.getMessage()).endsWith("at position " + position);
        }

        @Test
        void unknownIdentifierIsNamed() {
            var error = catchThrowableOfType(() -> Expr.parse("2 * exp(x)"), SyntaxError.class);
            assertThat(error.getMessage()).contains("unknown identifier 'exp'");
        }

        @Test
        void missingClosingBracketMentionsEndOfInput() {
            var error = catchThrowableOfType(() -> Expr.parse("log(x"), SyntaxError.class);
            assertThat(error.getMessage()).contains("end of input").contains("')'");
        }
    }

    @Nested
    @DisplayName("Node construction")
    class Construction {

        @Test
        void unknownFunctionNameIsAConstructionError() {
            assertThatThrownBy(() -> new CallEx("exp", Var.X))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("exp");
        }

        @Test
        void unknownOperatorIsAConstructionError() {
            assertThatThrownBy(() -> BinEx.Op.of('%')).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void childrenMustNotBeNull() {
            assertThatThrownBy(() -> new Pow(Var.X, null)).isInstanceOf(NullPointerException.class);
        }

        @Test
        void knownFunctionNamesResolve() {
            assertThat(new CallEx("tan", Var.X).func).isEqualTo(CallEx.Func.TAN);
        }
    }

    @Nested
    @DisplayName("Formula output")
    class Output {

        @Test
        void toStringIsFullyParenthesized() throws SyntaxError {
            assertThat(Expr.parse("2 * x^3").toString()).isEqualTo("(2 * (x ^ 3))");
        }

        @Test
        void replicateToWritesACompactFormula() throws SyntaxError {
            var bo = new java.io.ByteArrayOutputStream();
            Expr.parse("log(x) / 0.5 - x").replicateTo(new java.io.PrintStream(bo));
            assertThat(bo.toString()).isEqualTo("((log(x)/0.5)-x)");
        }

        @Test
        void constantsPrintWithoutSpuriousDecimals() {
            assertThat(new Const(2).toString()).isEqualTo("2");
            assertThat(new Const(2.25).toString()).isEqualTo("2.25");
            assertThat(new Const(-1).toString()).isEqualTo("(-1)");
        }

        @Test
        void replicatedFormulaOfNonNegativeTreeParsesBackToTheSameValues() throws SyntaxError {
            var original = Expr.parse("x^2 * cos(x) + log(x) * cos(x - 1)");
            var bo = new java.io.ByteArrayOutputStream();
            original.replicateTo(new java.io.PrintStream(bo));
            var reparsed = Expr.parse(bo.toString());

            var z = new Complex(2, 2);
            assertThat(reparsed.eval(z)).isEqualTo(original.eval(z));
        }
    }
}
