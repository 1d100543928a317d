package com.wechaty.plugin.http;

import com.wechaty.plugin.http.PluginHttpRegistry.HttpRouteRegistration;

import java.util.Comparator;
import java.util.List;

/**
 * Plain-text table of the registered routes, logged when the server starts.
 */
public final class PluginRouteTable {

    static final String EMPTY = "No routes were registered.";

    private static final String[] HEADERS = {"Endpoint", "Methods", "Websocket", "Rule"};

    private PluginRouteTable() {
    }

    public static String render(List<HttpRouteRegistration> routes) {
        if (routes == null || routes.isEmpty()) {
            return EMPTY;
        }

        List<String[]> rows = routes.stream()
                .sorted(Comparator.comparing(HttpRouteRegistration::getEndpoint))
                .map(r -> new String[]{
                        r.getEndpoint(),
                        String.join(", ", r.getMethods()),
                        String.valueOf(r.isWebsocket()),
                        r.getPath()})
                .toList();

        int[] widths = new int[HEADERS.length];
        for (int i = 0; i < HEADERS.length; i++) {
            widths[i] = HEADERS[i].length();
        }
        for (String[] row : rows) {
            for (int i = 0; i < row.length; i++) {
                widths[i] = Math.max(widths[i], row[i].length());
            }
        }

        StringBuilder sb = new StringBuilder();
        appendRow(sb, HEADERS, widths);
        String[] rule = new String[widths.length];
        for (int i = 0; i < widths.length; i++) {
            rule[i] = "-".repeat(widths[i]);
        }
        appendRow(sb, rule, widths);
        for (String[] row : rows) {
            appendRow(sb, row, widths);
        }
        return sb.toString().stripTrailing();
    }

    private static void appendRow(StringBuilder sb, String[] cells, int[] widths) {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < cells.length; i++) {
            if (i > 0) {
                line.append(" | ");
            }
            line.append(cells[i]).append(" ".repeat(widths[i] - cells[i].length()));
        }
        sb.append(line.toString().stripTrailing()).append('\n');
    }
}
