// src/main/java/com/example/regulations/assistantservice/service/chunk/TextChunker.java
package com.example.regulations.assistantservice.service.chunk;

import com.example.regulations.assistantservice.config.RagProperties;
import com.example.regulations.assistantservice.model.TextChunk;
import com.example.regulations.assistantservice.service.chunk.TextTokenizer.Token;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits document text into overlapping, sentence-aligned chunks measured in
 * whitespace tokens.
 * <p>
 * Chunk spans tile the text: the first chunk starts at offset 0, the last ends at the
 * text length, and each chunk runs up to the first token of whatever follows it. That
 * makes {@link #reconstruct(List)} exact.
 */
@Component
public class TextChunker {

    // token ends a sentence: terminal punctuation, optionally followed by closing quotes/brackets
    private static final Pattern SENTENCE_END = Pattern.compile(".*[.!?][\"'”’)\\]]*");
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n[ \\t\\x0B\\f\\r]*\\n");

    private final ChunkingConfig defaults;

    public TextChunker(RagProperties properties) {
        this(new ChunkingConfig(properties.getChunking().getMaxTokens(),
                properties.getChunking().getOverlapTokens()));
    }

    public TextChunker(ChunkingConfig defaults) {
        this.defaults = defaults.validate();
    }

    public ChunkingConfig defaults() {
        return defaults;
    }

    public List<TextChunk> chunk(String text) {
        return chunk(text, defaults);
    }

    public List<TextChunk> chunk(String text, ChunkingConfig config) {
        config.validate();
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<Token> tokens = TextTokenizer.tokenize(text);
        List<int[]> units = units(text, tokens, config);

        boolean[] unitStart = new boolean[tokens.size() + 1];
        for (int[] u : units) unitStart[u[0]] = true;

        int max = config.maxTokens();
        List<TextChunk> chunks = new ArrayList<>();
        int u = 0;
        int prevStart = 0;
        int prevEnd = 0;
        while (u < units.size()) {
            int[] first = units.get(u);
            int start = first[0];
            if (!chunks.isEmpty()) {
                int capacity = max - (first[1] - first[0]);
                int target = Math.min(config.overlapTokens(), capacity);
                start = prevEnd - overlapLength(unitStart, prevStart, prevEnd, target);
            }
            int end = first[1];
            u++;
            while (u < units.size() && units.get(u)[1] - start <= max) {
                end = units.get(u)[1];
                u++;
            }
            chunks.add(toChunk(text, tokens, chunks.size(), start, end));
            prevStart = start;
            prevEnd = end;
        }
        return chunks;
    }

    /**
     * Rebuilds the original text from an ordered chunk list by dropping each chunk's
     * overlap with its predecessor.
     */
    public static String reconstruct(List<TextChunk> chunks) {
        StringBuilder out = new StringBuilder();
        TextChunk previous = null;
        for (TextChunk chunk : chunks) {
            if (previous == null) {
                out.append(chunk.text());
            } else {
                int overlap = Math.max(0, previous.endOffset() - chunk.startOffset());
                out.append(chunk.text(), overlap, chunk.text().length());
            }
            previous = chunk;
        }
        return out.toString();
    }

    // Sentences as token ranges [from, to); sentences longer than max are hard-split.
    private List<int[]> units(String text, List<Token> tokens, ChunkingConfig config) {
        List<int[]> units = new ArrayList<>();
        int step = config.maxTokens() - config.overlapTokens();
        int sentenceStart = 0;
        for (int i = 0; i < tokens.size(); i++) {
            boolean last = i == tokens.size() - 1;
            if (last || endsSentence(text, tokens, i)) {
                int to = i + 1;
                if (to - sentenceStart > config.maxTokens()) {
                    for (int from = sentenceStart; from < to; from += step) {
                        units.add(new int[]{from, Math.min(to, from + step)});
                    }
                } else {
                    units.add(new int[]{sentenceStart, to});
                }
                sentenceStart = to;
            }
        }
        return units;
    }

    private boolean endsSentence(String text, List<Token> tokens, int i) {
        Token token = tokens.get(i);
        if (SENTENCE_END.matcher(text.substring(token.start(), token.end())).matches()) {
            return true;
        }
        String gap = text.substring(token.end(), tokens.get(i + 1).start());
        return PARAGRAPH_BREAK.matcher(gap).find();
    }

    // Longest whole-sentence overlap that fits the target, else a plain token overlap.
    private int overlapLength(boolean[] unitStart, int prevStart, int prevEnd, int target) {
        if (target <= 0) {
            return 0;
        }
        for (int s = Math.max(prevEnd - target, prevStart + 1); s < prevEnd; s++) {
            if (unitStart[s]) {
                return prevEnd - s;
            }
        }
        return Math.min(target, prevEnd - prevStart - 1);
    }

    private TextChunk toChunk(String text, List<Token> tokens, int index, int startToken, int endToken) {
        int startOffset = index == 0 ? 0 : tokens.get(startToken).start();
        int endOffset = endToken == tokens.size() ? text.length() : tokens.get(endToken).start();
        return new TextChunk(index, text.substring(startOffset, endOffset), startOffset, endOffset,
                endToken - startToken);
    }
}
