package com.raditha.checkcode.cli;

import com.raditha.checkcode.analyzer.ProgressListener;

import java.io.PrintWriter;

/**
 * A very small text progress bar, redrawn in place:
 * {@code analyse [########------------] 8/20}.
 * A newline is printed once a phase completes.
 */
public class ConsoleProgressBar implements ProgressListener {

    static final int BAR_LENGTH = 20;

    private final PrintWriter out;

    public ConsoleProgressBar(PrintWriter out) {
        this.out = out;
    }

    @Override
    public void onProgress(int current, int total, String label) {
        if (total <= 0) {
            return;
        }
        out.print("\r" + render(current, total, label));
        if (current >= total) {
            out.println();
        }
        out.flush();
    }

    static String render(int current, int total, String label) {
        int filled = (int) ((long) BAR_LENGTH * Math.min(current, total) / total);
        return label + " [" + "#".repeat(filled) + "-".repeat(BAR_LENGTH - filled) + "] " + current + "/" + total;
    }
}
