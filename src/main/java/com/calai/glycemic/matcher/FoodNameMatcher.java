package com.calai.glycemic.matcher;

import com.calai.glycemic.knowledge.nlp.FoodNameNorm;
import com.calai.glycemic.matcher.model.FoodCandidate;
import com.calai.glycemic.matcher.model.FoodMatchResult;
import com.calai.glycemic.matcher.model.MatchMode;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * 食物名稱比對：
 * 1) 正規化後完全命中 → 直接回傳，不跑相似度
 * 2) 有 embedding：query 向量 · 每個 corpus 單位向量（cosine），partial top-k 後分頁
 * 3) 沒有 embedding：子字串比對，score = len(query) / len(name)
 * <p>
 * corpus 向量只在建構時算一次（分批）；之後唯讀，可多執行緒同時查。
 * embedding 能力在建構時決定一次（embeddingsEnabled），查詢時只看這個旗標。
 */
@Slf4j
public class FoodNameMatcher {

    public static final int DEFAULT_BATCH_SIZE = 32;

    private final List<String> corpus;
    private final Set<String> corpusKeys;
    private final EmbeddingModel embeddingModel;
    private final float[][] corpusVectors;
    private final boolean embeddingsEnabled;

    /** 無 embedding：純子字串模式 */
    public FoodNameMatcher(List<String> names) {
        this(names, null, DEFAULT_BATCH_SIZE);
    }

    public FoodNameMatcher(List<String> names, EmbeddingModel embeddingModel, int batchSize) {
        this.corpus = List.copyOf(names);
        this.corpusKeys = Set.copyOf(corpus);

        float[][] vectors = null;
        if (embeddingModel != null) {
            try {
                long t0 = System.nanoTime();
                vectors = embedCorpus(embeddingModel, corpus, Math.max(1, batchSize));
                log.info("[FoodMatcher] embeddings computed for {} foods in {} ms",
                        corpus.size(), (System.nanoTime() - t0) / 1_000_000);
            } catch (RuntimeException e) {
                // 不讓啟動失敗；退回子字串比對
                log.warn("[FoodMatcher] embedding corpus failed, falling back to substring matching: {}", e.toString());
                vectors = null;
            }
        } else {
            log.info("[FoodMatcher] no embedding provider, using substring matching for {} foods", corpus.size());
        }

        this.embeddingsEnabled = vectors != null;
        this.embeddingModel = embeddingsEnabled ? embeddingModel : null;
        this.corpusVectors = embeddingsEnabled ? vectors : new float[0][];
    }

    public boolean embeddingsEnabled() {
        return embeddingsEnabled;
    }

    public int corpusSize() {
        return corpus.size();
    }

    /** 正規化後是 corpus key 就回傳；完全不碰相似度搜尋 */
    public Optional<String> resolveExact(String query) {
        String key = FoodNameNorm.normalize(query);
        if (key.isEmpty() || !corpusKeys.contains(key)) return Optional.empty();
        return Optional.of(key);
    }

    /**
     * 依相似度排序，回傳 [offset, offset + topK) 這一頁。
     * 下一頁：offset += topK（corpus 向量不重算）。空 list = 找不到相似的，不是錯誤。
     */
    public List<FoodCandidate> findCandidates(String query, int topK, int offset) {
        return search(query, topK, offset).items();
    }

    /** exact 優先；否則回傳候選頁與 nextOffset */
    public FoodMatchResult resolve(String query, int topK, int offset) {
        Optional<String> exact = resolveExact(query);
        if (exact.isPresent()) {
            return FoodMatchResult.exact(query, exact.get());
        }
        Page page = search(query, topK, offset);
        long end = (long) offset + topK;
        Integer next = (end < page.total()) ? (int) end : null;
        return new FoodMatchResult(query, null, page.items(), offset, topK, next, page.mode());
    }

    // ===== search =====

    private record Page(List<FoodCandidate> items, int total, MatchMode mode) {}

    private Page search(String query, int topK, int offset) {
        if (topK < 1) throw new IllegalArgumentException("topK must be >= 1");
        if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");

        MatchMode mode = embeddingsEnabled ? MatchMode.EMBEDDING : MatchMode.SUBSTRING;
        if (query == null || query.isBlank()) return new Page(List.of(), 0, mode);

        if (embeddingsEnabled) {
            float[] q;
            try {
                q = unit(embeddingModel.embed(FoodNameNorm.normalize(query)).content().vector());
            } catch (RuntimeException e) {
                // 單次 query embed 失敗也不讓查詢中斷
                log.warn("[FoodMatcher] query embedding failed, substring fallback for this query: {}", e.toString());
                return bySubstring(query, topK, offset);
            }
            return byEmbedding(q, topK, offset);
        }
        return bySubstring(query, topK, offset);
    }

    private Page byEmbedding(float[] queryVector, int topK, int offset) {
        int n = corpusVectors.length;
        double[] sims = new double[n];
        for (int i = 0; i < n; i++) sims[i] = dot(corpusVectors[i], queryVector);

        // 先挑 topK + offset 個，再切這一頁
        int want = (int) Math.min((long) topK + offset, n);
        List<Integer> top = TopKSelector.topIndices(sims, want);

        List<FoodCandidate> out = new ArrayList<>(Math.min(topK, Math.max(0, top.size() - offset)));
        for (int r = offset; r < top.size() && r < (long) offset + topK; r++) {
            int idx = top.get(r);
            out.add(new FoodCandidate(corpus.get(idx), clamp01(sims[idx])));
        }
        log.debug("[FoodMatcher] embedding search offset={} topK={} -> {} candidate(s)", offset, topK, out.size());
        return new Page(out, n, MatchMode.EMBEDDING);
    }

    private Page bySubstring(String query, int topK, int offset) {
        String q = query.toLowerCase(Locale.ROOT);
        List<FoodCandidate> matches = new ArrayList<>();
        for (String name : corpus) {
            String lower = name.toLowerCase(Locale.ROOT);
            if (lower.contains(q)) {
                matches.add(new FoodCandidate(name, (double) q.length() / lower.length()));
            }
        }
        // stable sort：同分維持 corpus 順序
        matches.sort(Comparator.comparingDouble(FoodCandidate::score).reversed());

        int from = Math.min(offset, matches.size());
        int to = (int) Math.min((long) offset + topK, matches.size());
        return new Page(List.copyOf(matches.subList(from, to)), matches.size(), MatchMode.SUBSTRING);
    }

    // ===== vectors =====

    private static float[][] embedCorpus(EmbeddingModel model, List<String> names, int batchSize) {
        float[][] out = new float[names.size()][];
        for (int start = 0; start < names.size(); start += batchSize) {
            int end = Math.min(start + batchSize, names.size());
            List<TextSegment> batch = new ArrayList<>(end - start);
            for (int i = start; i < end; i++) batch.add(TextSegment.from(names.get(i)));

            Response<List<Embedding>> resp = model.embedAll(batch);
            List<Embedding> embeddings = resp == null ? null : resp.content();
            if (embeddings == null || embeddings.size() != batch.size()) {
                throw new IllegalStateException("embedding batch size mismatch: expected " + batch.size()
                        + ", got " + (embeddings == null ? "null" : embeddings.size()));
            }
            for (int i = start; i < end; i++) {
                out[i] = unit(embeddings.get(i - start).vector());
            }
        }
        return out;
    }

    /** L2 正規化；零向量維持全 0（與任何 query 相似度都是 0） */
    static float[] unit(float[] v) {
        if (v == null) return new float[0];
        double sum = 0.0;
        for (float x : v) sum += (double) x * x;
        double norm = Math.sqrt(sum);
        float[] out = new float[v.length];
        if (norm == 0.0 || !Double.isFinite(norm)) return out;
        for (int i = 0; i < v.length; i++) out[i] = (float) (v[i] / norm);
        return out;
    }

    private static double dot(float[] a, float[] b) {
        int len = Math.min(a.length, b.length);
        double s = 0.0;
        for (int i = 0; i < len; i++) s += (double) a[i] * b[i];
        return s;
    }

    private static double clamp01(double v) {
        if (v < 0.0) return 0.0;
        return Math.min(1.0, v);
    }
}
