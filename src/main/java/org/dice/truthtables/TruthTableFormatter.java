package org.dice.truthtables;

import com.google.common.base.Strings;
import org.apache.commons.lang.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a table as text: a header line, a dashed rule, then one line per row with T / F cells.
 * Every cell is centered to the width of the longest header plus two.
 */
public class TruthTableFormatter {

    private static final String SEPARATOR = " | ";
    private static final String NEWLINE = System.getProperty("line.separator");

    public static String format(TruthTable table) {
        List<String> headers = table.getHeaders();
        int width = columnWidth(headers);

        String headerLine = joinCentered(headers, width);
        StringBuilder sb = new StringBuilder();
        sb.append(headerLine).append(NEWLINE);
        sb.append(Strings.repeat("-", headerLine.length())).append(NEWLINE);

        for (TruthTableRow row : table.getRows()) {
            List<String> cells = new ArrayList<String>(row.size());
            for (int c = 0; c < row.size(); c++) {
                cells.add(row.get(c) ? "T" : "F");
            }
            sb.append(joinCentered(cells, width)).append(NEWLINE);
        }
        return sb.toString();
    }

    static int columnWidth(List<String> headers) {
        int longest = 0;
        for (String header : headers) {
            longest = Math.max(longest, header.length());
        }
        return longest + 2;
    }

    private static String joinCentered(List<String> cells, int width) {
        List<String> centered = new ArrayList<String>(cells.size());
        for (String cell : cells) {
            centered.add(StringUtils.center(cell, width));
        }
        return StringUtils.join(centered, SEPARATOR);
    }
}
