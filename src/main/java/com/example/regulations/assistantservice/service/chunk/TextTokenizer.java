package com.example.regulations.assistantservice.service.chunk;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Whitespace word tokenizer shared by chunking and prompt budgeting, so a chunk's
 * token count means the same thing on both paths.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class TextTokenizer {

    private static final Pattern WORD = Pattern.compile("\\S+");

    public record Token(int start, int end) {}

    public static List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        if (text == null) {
            return tokens;
        }
        Matcher m = WORD.matcher(text);
        while (m.find()) {
            tokens.add(new Token(m.start(), m.end()));
        }
        return tokens;
    }

    public static int count(String text) {
        if (text == null) {
            return 0;
        }
        int count = 0;
        Matcher m = WORD.matcher(text);
        while (m.find()) count++;
        return count;
    }

    /**
     * @return the prefix of {@code text} holding at most {@code maxTokens} tokens
     */
    public static String truncate(String text, int maxTokens) {
        if (text == null || maxTokens <= 0) {
            return "";
        }
        Matcher m = WORD.matcher(text);
        int seen = 0;
        int end = 0;
        while (m.find()) {
            if (++seen > maxTokens) {
                return text.substring(0, end);
            }
            end = m.end();
        }
        return text;
    }
}
