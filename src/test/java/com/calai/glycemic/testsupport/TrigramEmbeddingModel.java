package com.calai.glycemic.testsupport;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 測試用 embedding：字元 trigram 雜湊到固定維度，結果可重現、不需載入模型。
 * 字面越像 → cosine 越高。
 */
public class TrigramEmbeddingModel implements EmbeddingModel {

    public static final int DIM = 256;

    private final AtomicInteger batchCalls = new AtomicInteger();
    private final AtomicInteger segmentsEmbedded = new AtomicInteger();
    private final AtomicInteger queryCalls = new AtomicInteger();

    @Override
    public Response<Embedding> embed(String text) {
        queryCalls.incrementAndGet();
        return Response.from(Embedding.from(vector(text)));
    }

    @Override
    public Response<Embedding> embed(TextSegment segment) {
        return embed(segment.text());
    }

    @Override
    public Response<List<Embedding>> embedAll(List<TextSegment> segments) {
        batchCalls.incrementAndGet();
        segmentsEmbedded.addAndGet(segments.size());
        List<Embedding> out = new ArrayList<>(segments.size());
        for (TextSegment s : segments) out.add(Embedding.from(vector(s.text())));
        return Response.from(out);
    }

    public int batchCalls() { return batchCalls.get(); }
    public int segmentsEmbedded() { return segmentsEmbedded.get(); }
    public int queryCalls() { return queryCalls.get(); }

    public static float[] vector(String text) {
        float[] v = new float[DIM];
        String t = "  " + text.toLowerCase(Locale.ROOT) + " ";
        for (int i = 0; i + 3 <= t.length(); i++) {
            v[Math.floorMod(t.substring(i, i + 3).hashCode(), DIM)] += 1f;
        }
        return v;
    }
}
