package com.splitttr.wiki.service;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of comparing two versions of one page, in the order the caller asked for.
 */
public record VersionDiff(
    PageVersion from,
    PageVersion to,
    List<LineDiff.Line> lines
) {
    public static final int DEFAULT_CONTEXT = 3;

    public static VersionDiff between(PageVersion from, PageVersion to) {
        List<LineDiff.Line> lines = LineDiff.compute(
            LineDiff.splitLines(from.content()), LineDiff.splitLines(to.content()));
        return new VersionDiff(from, to, List.copyOf(lines));
    }

    public long added() {
        return lines.stream().filter(l -> l.op() == LineDiff.Op.INSERT).count();
    }

    public long removed() {
        return lines.stream().filter(l -> l.op() == LineDiff.Op.DELETE).count();
    }

    public boolean identical() {
        return added() == 0 && removed() == 0;
    }

    // Unified diff text with the given number of context lines around each change.
    public String unified(int context) {
        StringBuilder sb = new StringBuilder();
        sb.append("--- ").append(from.label()).append('\n');
        sb.append("+++ ").append(to.label()).append('\n');

        List<Integer> changes = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).op() != LineDiff.Op.EQUAL) changes.add(i);
        }

        int c = 0;
        while (c < changes.size()) {
            int first = changes.get(c);
            int last = first;
            while (c + 1 < changes.size() && changes.get(c + 1) - last <= 2 * context + 1) {
                last = changes.get(++c);
            }
            c++;
            appendHunk(sb, Math.max(0, first - context), Math.min(lines.size(), last + context + 1));
        }
        return sb.toString();
    }

    private void appendHunk(StringBuilder sb, int start, int end) {
        int oldBefore = 0;
        int newBefore = 0;
        for (int i = 0; i < start; i++) {
            LineDiff.Op op = lines.get(i).op();
            if (op != LineDiff.Op.INSERT) oldBefore++;
            if (op != LineDiff.Op.DELETE) newBefore++;
        }
        int oldCount = 0;
        int newCount = 0;
        StringBuilder body = new StringBuilder();
        for (int i = start; i < end; i++) {
            LineDiff.Line line = lines.get(i);
            switch (line.op()) {
                case EQUAL -> {
                    oldCount++;
                    newCount++;
                    body.append(' ');
                }
                case DELETE -> {
                    oldCount++;
                    body.append('-');
                }
                case INSERT -> {
                    newCount++;
                    body.append('+');
                }
            }
            body.append(line.text()).append('\n');
        }
        sb.append("@@ -").append(oldCount == 0 ? oldBefore : oldBefore + 1).append(',').append(oldCount)
            .append(" +").append(newCount == 0 ? newBefore : newBefore + 1).append(',').append(newCount)
            .append(" @@\n");
        sb.append(body);
    }
}
