package com.example.regulations.assistantservice.support;

import com.example.regulations.assistantservice.config.RagProperties;
import com.example.regulations.assistantservice.model.DocumentChunk;
import com.example.regulations.assistantservice.model.RegulatoryDocument;
import com.example.regulations.assistantservice.service.support.Hashing;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

public final class TestData {

    public static final String MODEL = "test-embed";
    public static final int DIMENSION = 64;

    private TestData() {
    }

    /**
     * Properties with fast retries, no page delay and a small embedding dimension.
     */
    public static RagProperties properties() {
        RagProperties p = new RagProperties();
        p.getEmbedding().setModelVersion(MODEL);
        p.getEmbedding().setDimension(DIMENSION);
        p.getEmbedding().setBatchSize(4);
        p.getEmbedding().setMaxAttempts(3);
        p.getEmbedding().setInitialBackoff(Duration.ofMillis(1));
        p.getEmbedding().setBatchTimeout(Duration.ofSeconds(5));
        p.getSource().setPageDelay(Duration.ZERO);
        p.getSource().setMaxAttempts(3);
        p.getSource().setInitialBackoff(Duration.ofMillis(1));
        p.getQuery().setTimeout(Duration.ofSeconds(5));
        return p;
    }

    public static RegulatoryDocument document(String id, String agencyId, LocalDate published, String text) {
        return RegulatoryDocument.builder()
                .sourceId(id)
                .title("Title of " + id)
                .agencyId(agencyId)
                .agencyName(agencyId == null ? null : agencyId.replace('-', ' '))
                .documentType("Rule")
                .publicationDate(published)
                .text(text)
                .checksum(Hashing.sha256(text))
                .build();
    }

    /**
     * One chunk per text, embedded with the bag-of-words model.
     */
    public static List<DocumentChunk> chunks(String documentId, String... texts) {
        List<DocumentChunk> out = new ArrayList<>();
        int offset = 0;
        for (int i = 0; i < texts.length; i++) {
            out.add(DocumentChunk.builder()
                    .documentId(documentId)
                    .sequenceIndex(i)
                    .text(texts[i])
                    .startOffset(offset)
                    .endOffset(offset + texts[i].length())
                    .tokenCount(texts[i].split("\\s+").length)
                    .embedding(DocumentChunk.toList(BagOfWordsEmbeddingClient.vectorOf(texts[i], DIMENSION)))
                    .modelVersion(MODEL)
                    .build());
            offset += texts[i].length();
        }
        return out;
    }

    /**
     * {@code sentences} sentences of {@code wordsPerSentence} distinct words each.
     */
    public static String sentences(int sentences, int wordsPerSentence) {
        StringBuilder sb = new StringBuilder();
        int word = 0;
        for (int s = 0; s < sentences; s++) {
            for (int w = 0; w < wordsPerSentence; w++) {
                if (sb.length() > 0) sb.append(' ');
                sb.append("word").append(word++);
            }
            sb.append('.');
        }
        return sb.toString();
    }
}
