package differentiator;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import com.googlecode.lanterna.TerminalPosition;
import com.googlecode.lanterna.TerminalSize;
import com.googlecode.lanterna.TextColor;
import com.googlecode.lanterna.graphics.TextGraphics;
import com.googlecode.lanterna.gui2.MultiWindowTextGUI;
import com.googlecode.lanterna.gui2.WindowBasedTextGUI;
import com.googlecode.lanterna.gui2.dialogs.MessageDialog;
import com.googlecode.lanterna.gui2.dialogs.MessageDialogButton;
import com.googlecode.lanterna.gui2.dialogs.TextInputDialog;
import com.googlecode.lanterna.input.KeyStroke;
import com.googlecode.lanterna.input.KeyType;
import com.googlecode.lanterna.screen.Screen;
import com.googlecode.lanterna.screen.TerminalScreen;
import com.googlecode.lanterna.terminal.DefaultTerminalFactory;

/**
 * Terminal value table: one row per point z, columns z, f(z), f'(z) and f''(z).
 */
public class Explorer {
    public static final int ROWS=16;
    public static final int COLS=4;
    public static final int WIDTH=26;
    private static final int GUTTER=4;
    private static final String[] HEADERS={"z","f(z)","f'(z)","f''(z)"};
    private static final String[] FORMULAS={"f(x)","f'(x)","f''(x)"};

    private String expression;
    private Derivatives derivatives;
    private Optional<Complex>[] points = new Optional[ROWS];
    private Optional<Complex>[][] values = new Optional[ROWS][COLS];
    private int cursorcol=0,cursorrow=0;

    public Explorer(String expression) throws Expr.Parser.SyntaxError {
        Arrays.fill(points, Optional.empty());
        setExpression(expression);
    }
    public String getExpression(){
        return expression;
    }
    /**
     * Replaces the tabulated function; on a syntax error the previous one stays in place
     * @param expression
     * @throws Expr.Parser.SyntaxError
     */
    public void setExpression(String expression) throws Expr.Parser.SyntaxError {
        derivatives=Derivatives.differentiate(expression);
        this.expression=expression;
        purgeValues();
    }
    public Optional<Complex> getPoint(int row){
        return points[row];
    }
    public void setPoint(int row,Optional<Complex> point){
        points[row]=point;
        purgeValues();
    }
    /**
     * To start evaluation anew, we need to purge all old cached values from values[][]
     */
    private void purgeValues(){
        values = new Optional[ROWS][COLS];
    }
    /**
     * value of the cell at row / col, cached in values[][]; column 0 is the point itself,
     * columns 1 to 3 the function and its derivatives at that point
     * @param row
     * @param col
     * @return empty if the row has no point
     */
    public Optional<Complex> eval(int row,int col){
        if (values[row][col]==null) {
            if (col==0) values[row][col]=points[row];
            else {
                var tree = derivatives.tree(col-1);
                values[row][col]=points[row].map(tree::eval);
            }
        }
        return values[row][col];
    }

    /**
     * moves the active cell, wrapping around at the borders
     */
    void moveCursor(int drow,int dcol){
        cursorrow=(ROWS+cursorrow+drow)%ROWS;
        cursorcol=(COLS+cursorcol+dcol)%COLS;
    }

    public static String formatComplex(Complex z){
        return String.format(Locale.ROOT,"(%.6g,%.6g)",z.real,z.imag);
    }
    /**
     * Takes a point as typed by the user, e.g. "2", "2;2" or "1.5 -3", and returns it as complex number
     * @param text
     * @return empty for blank input
     * @throws NumberFormatException if the text is no point, an empty part such as "1;" included
     */
    public static Optional<Complex> parsePoint(String text){
        var trimmed = text.trim();
        if (trimmed.isEmpty()) return Optional.empty();
        var parts = trimmed.split("\\s*;\\s*|\\s+",-1);
        if (parts.length>2) throw new NumberFormatException("a point has at most two parts: "+text);
        var real = Double.parseDouble(parts[0]);
        var imag = parts.length==2 ? Double.parseDouble(parts[1]) : 0.0;
        return Optional.of(new Complex(real,imag));
    }

    /**
     *  print out the frame for a Cell
     */
    private static void drawCellToConsole(TextGraphics textGraphics, int row ,int col , String txt) {
        int x0 = GUTTER + col * (WIDTH+1);
        int y0 = row * 2;
        int x1 = x0 + (WIDTH+1);
        int y1 = y0 + 2;
        textGraphics.drawRectangle(new TerminalPosition(x0, y0), new TerminalSize(WIDTH+2, 3), (char)0x2500); //-
        textGraphics.drawLine(x0,y0,x0,y1,(char)0x2502); // |
        textGraphics.drawLine(x1,y0,x1,y1,(char)0x2502); // |
        textGraphics.setCharacter(x0,y0,(char)0x253C);   // +
        textGraphics.setCharacter(x0,y1,(char)0x253C);   // +
        textGraphics.setCharacter(x1,y0,(char)0x253C);   // +
        textGraphics.setCharacter(x1,y1,(char)0x253C);   // +
        var fitted = txt.length()>WIDTH-1 ? txt.substring(0,WIDTH-2)+"~" : txt;
        textGraphics.putString(x0+1,y0+1," "+fitted);
    }

    /**
     *  print out the actual content of the cell, and delegate to drawCellToConsole for the frame
     */
    private void drawDataCellToConsole(TextGraphics textgraphics, int row,int col){
        var str = eval(row,col)
            .map(z -> z.isNaN() ? "### undefined" : formatComplex(z))
            .orElse("");
        drawCellToConsole(textgraphics, row+1,col, str);
    }
    /**
     *  prints the whole table to the console, and evens out some borderframes
     *  @return formula of the selected column
     */
    public String printToConsole(Screen screen, TextGraphics textGraphics) throws IOException {
        screen.clear();
        IntStream.range(0,COLS).forEachOrdered(cols ->
            drawCellToConsole(textGraphics, 0, cols, HEADERS[cols])
            );
        for (int cols = 0; cols < COLS;cols++)
            for (int rows=0; rows< ROWS; rows++)
                drawDataCellToConsole(textGraphics, rows,cols);
        int right = GUTTER+COLS*(WIDTH+1);
        for (int j=0; j< ROWS+2; j++) { // Finalize Border lines
            textGraphics.setCharacter(GUTTER,j*2,(char)0x251C);   // ├
            textGraphics.setCharacter(right,j*2,(char)0x2524);    // ┤
            if (j>0 && j<=ROWS) textGraphics.putString(0,j*2+1," "+j);
        }
        for (int c=0; c< COLS+1; c++) {
            textGraphics.setCharacter(GUTTER+c*(WIDTH+1),0,(char)0x252C);            // ┬
            textGraphics.setCharacter(GUTTER+c*(WIDTH+1),(ROWS+1)*2,(char)0x2534);   // ┴
        }
        // red frame around the active cell:
        textGraphics.setForegroundColor(TextColor.ANSI.RED);
        drawDataCellToConsole(textGraphics,cursorrow,cursorcol);
        textGraphics.setForegroundColor(TextColor.ANSI.DEFAULT);
        // formula behind the active column at the bottom line:
        var formula = selectedFormula();
        textGraphics.putString(1,2*(ROWS+2),formula);
        textGraphics.putString(1,2*(ROWS+2)+1,"arrows: move  enter: edit point  e: edit f  esc: quit");
        screen.setCursorPosition(new TerminalPosition(1+formula.length(), 2*(ROWS+2)));
        return formula;
    }
    /**
     * @return "f(x) = ..." for the point column and the function column, the derivative formula otherwise
     */
    String selectedFormula(){
        if (cursorcol<=1) return FORMULAS[0]+" = "+expression;
        var bo = new ByteArrayOutputStream();
        derivatives.tree(cursorcol-1).replicateTo(new PrintStream(bo));
        return FORMULAS[cursorcol-1]+" = "+bo.toString();
    }

    /**
     * writes one line per point: re;im;f(z);f'(z);f''(z)
     */
    public void writeToCSV(String filename) throws IOException {
        var pw = new PrintWriter(new File(filename));
        for (int row=0; row<ROWS; row++){
            if (points[row].isEmpty()) continue;
            var z = points[row].get();
            final int r = row;
            pw.println(z.real+";"+z.imag+";"+IntStream.range(1,COLS)
                .mapToObj(c -> formatComplex(eval(r,c).get()))
                .collect(Collectors.joining(";")));
        }
        pw.close();
    }
    /**
     * reads up to ROWS points, one per line as accepted by parsePoint; further columns are ignored
     */
    public static Explorer parseCSV(String expression, String filename) throws FileNotFoundException,IOException,NumberFormatException,Expr.Parser.SyntaxError {
        var result = new Explorer(expression);
        var buffy = new BufferedReader(new FileReader(filename));
        var row =0;
        String line;
        while ((line = buffy.readLine())!=null && row < ROWS) {
            var fields = line.split(";");
            var point = fields.length>1 ? fields[0]+";"+fields[1] : line;
            result.setPoint(row++,parsePoint(point));
        }
        buffy.close();
        return result;
    }
    private static void editPoint(Explorer e, WindowBasedTextGUI textGUI) {
        var current = e.getPoint(e.cursorrow).map(z -> z.real+";"+z.imag).orElse("");
        String input = TextInputDialog.showDialog(textGUI,"Point","re;im for row "+(e.cursorrow+1),current);
        if (input==null) return;
        try {
            e.setPoint(e.cursorrow,parsePoint(input));
        } catch (NumberFormatException ex) {
            MessageDialog.showMessageDialog(textGUI,"Invalid point",ex.getMessage(),MessageDialogButton.OK);
        }
    }
    private static void editExpression(Explorer e, WindowBasedTextGUI textGUI) {
        String input = TextInputDialog.showDialog(textGUI,"Function","f(x) =",e.getExpression());
        if (input==null) return;
        try {
            e.setExpression(input);
        } catch (Expr.Parser.SyntaxError ex) {
            MessageDialog.showMessageDialog(textGUI,"Syntax error",ex.getMessage(),MessageDialogButton.OK);
        }
    }
    public static void main(String[] args) throws Exception{
        if (args.length<1) {
            System.err.println("Usage: explorer \"<expression>\" [points.csv]");
            System.exit(1);
        }
        Explorer e;
        try {
            e = args.length>1 ? parseCSV(args[0],args[1]) : new Explorer(args[0]);
        } catch (Expr.Parser.SyntaxError ex) {
            System.err.println("An error occurred: "+ex.getMessage());
            System.exit(1);
            return;
        }
        var terminal = new DefaultTerminalFactory().createTerminal();
        var screen = new TerminalScreen(terminal);
        screen.startScreen();
        var textGraphics = screen.newTextGraphics();
        KeyStroke key;
        final WindowBasedTextGUI textGUI = new MultiWindowTextGUI(screen);
        do {
            e.printToConsole(screen,textGraphics);
            screen.refresh();
            key=screen.readInput();
            switch (key.getKeyType()) {
                case ArrowDown:  e.moveCursor(1,0); break;
                case ArrowUp:    e.moveCursor(-1,0); break;
                case ArrowLeft:  e.moveCursor(0,-1); break;
                case ArrowRight: e.moveCursor(0,1); break;
                case Enter:      editPoint(e,textGUI); break;
                case Character:
                    if (key.getCharacter()=='e') editExpression(e,textGUI);
                    break;
                default:
            }
        }
        while (key.getKeyType()!=KeyType.Escape && key.getKeyType()!=KeyType.EOF);
        screen.stopScreen();
        screen.close();
        e.writeToCSV("out.csv");
        System.out.println(e);
   }
   @Override
   public String toString() {
       return "f(x) = "+expression+"\n"+IntStream.range(0,ROWS)
               .filter(row -> points[row].isPresent())
               .mapToObj(row -> IntStream.range(0,COLS)
                       .mapToObj(col -> formatComplex(eval(row,col).get()))
                       .collect(Collectors.joining(" - ")))
               .collect(Collectors.joining("\n"));
   }
}
