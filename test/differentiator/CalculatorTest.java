package differentiator;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Command line front end")
class CalculatorTest {
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private int run(String... args) {
        return Calculator.run(args, new PrintStream(out, true), new PrintStream(err, true));
    }

    @Test
    void printsFunctionPointAndAllThreeValues() {
        assertThat(run("sin(x)", "0", "0")).isZero();

        var lines = out.toString().split("\\R");
        assertThat(lines).hasSize(6);
        assertThat(lines[0]).isEqualTo("Function: f(x) = sin(x)");
        assertThat(lines[1]).isEqualTo("Point:    z    = (0,0)");
        assertThat(lines[2]).startsWith("-----");
        assertThat(lines[3]).isEqualTo("f(z)   = (0,0)");
        assertThat(lines[4]).startsWith("f'(z)  = (");
        assertThat(lines[5]).startsWith("f''(z) = (");
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void imaginaryPartDefaultsToZero() {
        assertThat(run("x^2 + 3*x", "1")).isZero();
        assertThat(out.toString()).contains("Point:    z    = (1,0)");
    }

    @Test
    void valuesArePrintedWithoutTrailingZeros() {
        assertThat(run("2 * x^3", "2", "2")).isZero();
        assertThat(out.toString())
            .contains("Point:    z    = (2,2)")
            .contains("f(z)   = (-32,32)");
    }

    @Test
    void wrongArgumentCountPrintsUsage() {
        assertThat(run("x")).isEqualTo(1);
        assertThat(err.toString()).contains("Usage:");
        assertThat(out.toString()).isEmpty();

        assertThat(run("x", "1", "2", "3")).isEqualTo(1);
    }

    @Test
    void malformedPointIsReported() {
        assertThat(run("x", "one")).isEqualTo(1);
        assertThat(err.toString())
            .contains("Invalid number format")
            .contains("Usage:");
    }

    @Test
    void syntaxErrorIsReportedWithPosition() {
        assertThat(run("2x", "1")).isEqualTo(1);
        assertThat(err.toString()).contains("An error occurred:").contains("at position 1");
    }
}
