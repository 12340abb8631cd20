package com.stagegate.sandbox;

import com.stagegate.core.StageGateException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;

/**
 * Yes/no questions on the terminal, shared by every console collaborator so they read
 * from one buffered stdin.
 */
public class ConsolePrompt {

    private final BufferedReader in;
    private final PrintStream out;

    public ConsolePrompt(InputStream in, PrintStream out) {
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
    }

    public void print(String text) {
        out.println(text);
    }

    /**
     * Asks until the answer is yes or no. Empty when input is closed.
     */
    public synchronized Optional<Boolean> confirm(String question) {
        try {
            while (true) {
                out.print(question + " [y/n] ");
                out.flush();
                String line = in.readLine();
                if (line == null) {
                    return Optional.empty();
                }
                switch (line.trim().toLowerCase(Locale.ROOT)) {
                    case "y", "yes" -> {
                        return Optional.of(true);
                    }
                    case "n", "no" -> {
                        return Optional.of(false);
                    }
                    default -> out.println("Please answer y or n.");
                }
            }
        } catch (IOException e) {
            throw new StageGateException("Cannot read console input", e);
        }
    }

    /** Reads one free-text line; empty when input is closed. */
    public synchronized Optional<String> ask(String question) {
        try {
            out.print(question + " ");
            out.flush();
            return Optional.ofNullable(in.readLine()).map(String::trim);
        } catch (IOException e) {
            throw new StageGateException("Cannot read console input", e);
        }
    }
}
