package com.deepansh.desk.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Line-oriented terminal access shared by the console loop and the console
 * decision provider.
 */
public class ConsoleIO {

    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleIO(InputStream in, PrintStream out) {
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
    }

    /**
     * Prints the prompt and reads one line.
     *
     * @return the line without its terminator, or null at end of input
     */
    public String readLine(String prompt) {
        out.print(prompt);
        out.flush();
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Console input failed", e);
        }
    }

    public void println(String text) {
        out.println(text);
        out.flush();
    }
}
