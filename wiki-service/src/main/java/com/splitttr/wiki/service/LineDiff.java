package com.splitttr.wiki.service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Line-oriented diff based on the longest common subsequence of lines.
 * Inside a changed block, deletions are emitted before insertions.
 */
public final class LineDiff {

    public enum Op { EQUAL, DELETE, INSERT }

    // Line numbers are 1-based; 0 means the line does not exist on that side.
    public record Line(Op op, int oldNumber, int newNumber, String text) {}

    private LineDiff() {
    }

    public static List<String> splitLines(String text) {
        if (text == null || text.isEmpty()) return List.of();
        List<String> lines = new ArrayList<>(Arrays.asList(text.split("\\R", -1)));
        if (lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }

    public static List<Line> compute(List<String> from, List<String> to) {
        int prefix = 0;
        while (prefix < from.size() && prefix < to.size() && from.get(prefix).equals(to.get(prefix))) {
            prefix++;
        }
        int suffix = 0;
        while (suffix < from.size() - prefix && suffix < to.size() - prefix
            && from.get(from.size() - 1 - suffix).equals(to.get(to.size() - 1 - suffix))) {
            suffix++;
        }

        List<Line> out = new ArrayList<>(from.size() + to.size());
        for (int i = 0; i < prefix; i++) {
            out.add(new Line(Op.EQUAL, i + 1, i + 1, from.get(i)));
        }

        int n = from.size() - prefix - suffix;
        int m = to.size() - prefix - suffix;
        int[][] lcs = new int[n + 1][m + 1];
        for (int i = n - 1; i >= 0; i--) {
            for (int j = m - 1; j >= 0; j--) {
                if (from.get(prefix + i).equals(to.get(prefix + j))) {
                    lcs[i][j] = lcs[i + 1][j + 1] + 1;
                } else {
                    lcs[i][j] = Math.max(lcs[i + 1][j], lcs[i][j + 1]);
                }
            }
        }

        List<Line> deleted = new ArrayList<>();
        List<Line> inserted = new ArrayList<>();
        int i = 0;
        int j = 0;
        while (i < n && j < m) {
            String left = from.get(prefix + i);
            if (left.equals(to.get(prefix + j))) {
                flush(out, deleted, inserted);
                out.add(new Line(Op.EQUAL, prefix + i + 1, prefix + j + 1, left));
                i++;
                j++;
            } else if (lcs[i + 1][j] >= lcs[i][j + 1]) {
                deleted.add(new Line(Op.DELETE, prefix + i + 1, 0, left));
                i++;
            } else {
                inserted.add(new Line(Op.INSERT, 0, prefix + j + 1, to.get(prefix + j)));
                j++;
            }
        }
        for (; i < n; i++) {
            deleted.add(new Line(Op.DELETE, prefix + i + 1, 0, from.get(prefix + i)));
        }
        for (; j < m; j++) {
            inserted.add(new Line(Op.INSERT, 0, prefix + j + 1, to.get(prefix + j)));
        }
        flush(out, deleted, inserted);

        for (int k = 0; k < suffix; k++) {
            int oldIndex = from.size() - suffix + k;
            int newIndex = to.size() - suffix + k;
            out.add(new Line(Op.EQUAL, oldIndex + 1, newIndex + 1, from.get(oldIndex)));
        }
        return out;
    }

    private static void flush(List<Line> out, List<Line> deleted, List<Line> inserted) {
        out.addAll(deleted);
        out.addAll(inserted);
        deleted.clear();
        inserted.clear();
    }
}
