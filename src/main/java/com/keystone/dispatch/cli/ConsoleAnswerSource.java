package com.keystone.dispatch.cli;

import com.keystone.core.interview.AnswerSet;
import com.keystone.core.interview.AnswerSource;
import com.keystone.core.interview.Choice;
import com.keystone.core.interview.Question;
import com.keystone.core.interview.QuestionKind;
import picocli.CommandLine;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Asks questions on a terminal. A blank line takes the default; on a required question
 * without one it is passed on as an empty answer, which fails validation and is asked
 * again. End of input means "no answer". Choices may be picked by number or by value;
 * multiselect answers are comma separated.
 */
public class ConsoleAnswerSource implements AnswerSource {

    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleAnswerSource(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    public static ConsoleAnswerSource system() {
        return new ConsoleAnswerSource(
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    @Override
    public Optional<Object> solicit(Question question, AnswerSet answersSoFar) {
        if (question.kind().hasChoices()) {
            List<Choice> choices = question.choices();
            for (int i = 0; i < choices.size(); i++) {
                Choice c = choices.get(i);
                String label = c.name() == null ? c.value() : c.name();
                out.println("    " + (i + 1) + ") " + label);
            }
        }
        out.print(CommandLine.Help.Ansi.AUTO.string("@|fg(cyan) ?|@ " + question.message() + hint(question) + ": "));
        out.flush();

        String line;
        try {
            line = in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read answer for '" + question.id() + "'", e);
        }
        if (line == null) {
            return Optional.empty();
        }
        if (line.isBlank()) {
            return question.isRequired() && question.defaultValue() == null
                    ? Optional.of("")
                    : Optional.empty();
        }
        String text = line.trim();
        return switch (question.kind()) {
            case SELECT -> Optional.of(resolveChoice(question, text));
            case MULTISELECT -> {
                var picked = new ArrayList<String>();
                for (String part : text.split(",")) {
                    if (!part.isBlank()) {
                        picked.add(resolveChoice(question, part.trim()));
                    }
                }
                yield Optional.of(picked);
            }
            default -> Optional.of(text);
        };
    }

    @Override
    public boolean isInteractive() {
        return true;
    }

    @Override
    public void reject(Question question, String reason) {
        out.println(CommandLine.Help.Ansi.AUTO.string("  @|fg(red) x|@ " + reason));
    }

    /** A 1-based index selects the choice at that position; anything else is taken as a value. */
    static String resolveChoice(Question question, String text) {
        List<Choice> choices = question.choices();
        if (text.length() <= 3 && text.chars().allMatch(Character::isDigit) && !question.hasChoice(text)) {
            int index = Integer.parseInt(text) - 1;
            if (index >= 0 && index < choices.size()) {
                return choices.get(index).value();
            }
        }
        return text;
    }

    private static String hint(Question question) {
        Object def = question.defaultValue();
        if (question.kind() == QuestionKind.CONFIRM) {
            return Boolean.TRUE.equals(def) ? " (Y/n)" : Boolean.FALSE.equals(def) ? " (y/N)" : " (y/n)";
        }
        if (def == null) {
            return "";
        }
        if (def instanceof List<?> list) {
            return " (" + String.join(",", list.stream().map(String::valueOf).toList()) + ")";
        }
        return " (" + def + ")";
    }
}
