// src/main/java/com/example/regulations/assistantservice/model/DocumentChunk.java
package com.example.regulations.assistantservice.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDate;
import java.util.List;

@Document("chunks")
@CompoundIndex(name = "doc_generation_seq", def = "{'documentId': 1, 'generation': 1, 'sequenceIndex': 1}", unique = true)
@Data @Builder(toBuilder = true) @NoArgsConstructor @AllArgsConstructor
public class DocumentChunk {
    @Id
    private String id;
    private String documentId;
    private String generation;
    private int sequenceIndex;
    private String text;
    private int startOffset;
    private int endOffset;
    private int tokenCount;
    private List<Double> embedding;
    private String modelVersion;
    // denormalized so vector search can pre-filter
    private String agencyId;
    private LocalDate publicationDate;

    public float[] embeddingArray() {
        if (embedding == null) {
            return new float[0];
        }
        float[] out = new float[embedding.size()];
        for (int i = 0; i < out.length; i++) out[i] = embedding.get(i).floatValue();
        return out;
    }

    public static List<Double> toList(float[] vector) {
        Double[] boxed = new Double[vector.length];
        for (int i = 0; i < vector.length; i++) boxed[i] = (double) vector[i];
        return List.of(boxed);
    }
}
