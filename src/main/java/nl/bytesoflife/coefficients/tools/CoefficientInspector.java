package nl.bytesoflife.coefficients.tools;

import nl.bytesoflife.coefficients.table.CoefficientTable;
import nl.bytesoflife.coefficients.table.CoefficientTables;
import nl.bytesoflife.coefficients.table.GridRanges;
import nl.bytesoflife.coefficients.table.SystemEntry;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Prints what a coefficient dataset contains, for checking system keys and fabric
 * categories before configuring them.
 *
 * <pre>
 * CoefficientInspector                       # systems of the bundled dataset
 * CoefficientInspector data.json             # systems of data.json
 * CoefficientInspector data.json uni1_zebra  # categories of one system
 * </pre>
 */
public class CoefficientInspector {

    private final CoefficientTable table;

    public CoefficientInspector(CoefficientTable table) {
        this.table = table;
    }

    public String describeSystems() {
        List<String[]> rows = new ArrayList<>();
        int index = 1;
        for (String systemKey : table.systems()) {
            rows.add(new String[]{
                    String.valueOf(index++),
                    systemKey,
                    String.valueOf(table.categories(systemKey).size())
            });
        }
        StringBuilder sb = new StringBuilder();
        sb.append("Systems: ").append(table.size()).append("\n");
        sb.append(formatTable(new String[]{"#", "System Key", "Categories"}, rows));
        return sb.toString();
    }

    /**
     * @param systemKey matched exactly first, then ignoring case
     * @return the category table of the system, or empty when the key is unknown
     */
    public Optional<String> describeSystem(String systemKey) {
        Optional<SystemEntry> entry = table.findSystemIgnoreCase(systemKey);
        if (entry.isEmpty()) {
            return Optional.empty();
        }
        String key = entry.get().getSystemKey();
        List<String[]> rows = new ArrayList<>();
        int index = 1;
        for (String category : entry.get().categories()) {
            GridRanges r = entry.get().grid(category).orElseThrow().ranges();
            rows.add(new String[]{
                    String.valueOf(index++),
                    category,
                    formatRange(r.widthMin(), r.widthMax()),
                    formatRange(r.heightMin(), r.heightMax()),
                    String.valueOf(r.widthPoints()),
                    String.valueOf(r.heightPoints())
            });
        }
        StringBuilder sb = new StringBuilder();
        sb.append("System \"").append(key).append("\": ")
          .append(rows.size()).append(" categories\n");
        sb.append(formatTable(
                new String[]{"#", "Category", "Width range", "Height range", "Widths", "Heights"}, rows));
        return Optional.of(sb.toString());
    }

    private static String formatRange(double min, double max) {
        return String.format(Locale.ROOT, "%.3fm - %.3fm", min, max);
    }

    static String formatTable(String[] headers, List<String[]> rows) {
        int[] widths = new int[headers.length];
        for (int i = 0; i < headers.length; i++) {
            widths[i] = headers[i].length();
            for (String[] row : rows) {
                widths[i] = Math.max(widths[i], row[i].length());
            }
        }

        StringBuilder sb = new StringBuilder();
        appendSeparator(sb, widths);
        appendRow(sb, headers, widths);
        appendSeparator(sb, widths);
        for (String[] row : rows) {
            appendRow(sb, row, widths);
        }
        appendSeparator(sb, widths);
        return sb.toString();
    }

    private static void appendSeparator(StringBuilder sb, int[] widths) {
        sb.append('+');
        for (int width : widths) {
            sb.append("-".repeat(width + 2)).append('+');
        }
        sb.append('\n');
    }

    private static void appendRow(StringBuilder sb, String[] cells, int[] widths) {
        sb.append('|');
        for (int i = 0; i < cells.length; i++) {
            sb.append(' ').append(cells[i]).append(" ".repeat(widths[i] - cells[i].length())).append(" |");
        }
        sb.append('\n');
    }

    public static void main(String[] args) throws IOException {
        CoefficientTable table = args.length > 0
                ? CoefficientTables.load(Path.of(args[0]))
                : CoefficientTables.bundled();
        CoefficientInspector inspector = new CoefficientInspector(table);

        if (args.length < 2) {
            System.out.print(inspector.describeSystems());
            return;
        }

        Optional<String> description = inspector.describeSystem(args[1]);
        if (description.isPresent()) {
            System.out.print(description.get());
        } else {
            System.err.println("System \"" + args[1] + "\" not found. Known systems:");
            for (String systemKey : table.systems()) {
                System.err.println("  - " + systemKey);
            }
            System.exit(1);
        }
    }
}
