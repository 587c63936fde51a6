package differentiator;

import java.io.PrintStream;


public class Calculator {
    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Expects the expression, the real part of the point and optionally its imaginary part.
     * @return process exit status, 0 on success
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length != 2 && args.length != 3) {
            printUsage(err);
            return 1;
        }
        var expression = args[0];
        Complex z;
        try {
            double real = Double.parseDouble(args[1]);
            double imag = args.length == 3 ? Double.parseDouble(args[2]) : 0.0;
            z = new Complex(real, imag);
        } catch (NumberFormatException e) {
            err.println("Error: Invalid number format for the point. Please provide valid numbers.");
            printUsage(err);
            return 1;
        }

        out.println("Function: f(x) = " + expression);
        out.println("Point:    z    = " + z);
        out.println("------------------------------------");
        try {
            var d = Derivatives.differentiate(expression);
            out.println("f(z)   = " + d.f().apply(z));
            out.println("f'(z)  = " + d.f1().apply(z));
            out.println("f''(z) = " + d.f2().apply(z));
        } catch (Expr.Parser.SyntaxError e) {
            err.println("An error occurred: " + e.getMessage());
            return 1;
        }
        return 0;
    }

    private static void printUsage(PrintStream err) {
        err.println("Usage:");
        err.println("  differentiate \"<expression>\" <real_part>");
        err.println("  differentiate \"<expression>\" <real_part> <imag_part>");
        err.println();
    }
}
