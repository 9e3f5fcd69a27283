package com.trustgate.guard.tool.impl;

import org.springframework.stereotype.Component;

import java.io.Console;
import java.io.PrintWriter;
import java.util.List;

@Component
public class ConsolePrompter implements HumanPrompter {

    @Override
    public boolean available() {
        return System.console() != null;
    }

    @Override
    public String ask(String question, List<String> options) {
        Console console = System.console();
        if (console == null) {
            return options.isEmpty() ? "yes" : options.get(0);
        }
        PrintWriter out = console.writer();
        out.println(question);
        if (options.isEmpty()) {
            String answer = console.readLine("Answer (default: yes): ");
            return answer == null || answer.isBlank() ? "yes" : answer.strip();
        }
        for (int i = 0; i < options.size(); i++) {
            out.println((i + 1) + ". " + options.get(i));
        }
        out.flush();
        return choose(console.readLine("Enter choice number (default 1): "), options);
    }

    static String choose(String input, List<String> options) {
        if (input == null || input.isBlank()) {
            return options.get(0);
        }
        try {
            int index = Integer.parseInt(input.strip()) - 1;
            return index >= 0 && index < options.size() ? options.get(index) : options.get(0);
        } catch (NumberFormatException e) {
            return options.get(0);
        }
    }
}
