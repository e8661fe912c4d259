package com.calai.glycemic.matcher;

import com.calai.glycemic.matcher.model.FoodCandidate;
import com.calai.glycemic.matcher.model.FoodMatchResult;
import com.calai.glycemic.matcher.model.MatchMode;
import com.calai.glycemic.testsupport.TrigramEmbeddingModel;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class FoodNameMatcherTest {

    private static final List<String> CORPUS = List.of(
            "white rice boiled",
            "brown rice boiled",
            "jasmine rice steamed",
            "arborio rice boiled",
            "rice noodles boiled",
            "apple raw",
            "banana ripe",
            "white bread",
            "whole wheat bread",
            "cabbage cruciferous boiled",
            "deli turkey poached",
            "sweet potato baked"
    );

    // ===== embedding mode =====

    @Test void embeds_corpus_once_in_batches() {
        TrigramEmbeddingModel model = new TrigramEmbeddingModel();
        FoodNameMatcher m = new FoodNameMatcher(CORPUS, model, 5);

        assertTrue(m.embeddingsEnabled());
        assertEquals(3, model.batchCalls());          // 5 + 5 + 2
        assertEquals(CORPUS.size(), model.segmentsEmbedded());

        m.findCandidates("rice", 5, 0);
        m.findCandidates("rice", 5, 5);
        // 分頁不重算 corpus，只多 embed query
        assertEquals(3, model.batchCalls());
        assertEquals(2, model.queryCalls());
    }

    @Test void similar_names_rank_first() {
        FoodNameMatcher m = new FoodNameMatcher(CORPUS, new TrigramEmbeddingModel(), 32);

        List<FoodCandidate> top = m.findCandidates("boiled rice", 3, 0);
        assertEquals(3, top.size());
        assertThat(top).allSatisfy(c -> assertThat(c.name()).contains("rice"));
    }

    @Test void scores_descending_and_clamped() {
        FoodNameMatcher m = new FoodNameMatcher(CORPUS, new TrigramEmbeddingModel(), 32);

        List<FoodCandidate> all = m.findCandidates("bread", CORPUS.size(), 0);
        assertEquals(CORPUS.size(), all.size());
        for (int i = 0; i < all.size(); i++) {
            assertThat(all.get(i).score()).isBetween(0.0, 1.0);
            if (i > 0) assertThat(all.get(i).score()).isLessThanOrEqualTo(all.get(i - 1).score());
        }
    }

    @Test void pages_are_disjoint_and_concatenate_to_larger_page() {
        FoodNameMatcher m = new FoodNameMatcher(CORPUS, new TrigramEmbeddingModel(), 32);

        List<FoodCandidate> first = m.findCandidates("rice boild", 5, 0);
        List<FoodCandidate> second = m.findCandidates("rice boild", 5, 5);
        List<FoodCandidate> ten = m.findCandidates("rice boild", 10, 0);

        Set<String> a = names(first);
        Set<String> b = names(second);
        assertThat(a).doesNotContainAnyElementsOf(b);

        List<FoodCandidate> joined = new ArrayList<>(first);
        joined.addAll(second);
        assertEquals(ten, joined);
    }

    @Test void offset_past_end_is_empty() {
        FoodNameMatcher m = new FoodNameMatcher(CORPUS, new TrigramEmbeddingModel(), 32);
        assertThat(m.findCandidates("rice", 5, CORPUS.size())).isEmpty();
        assertThat(m.findCandidates("rice", 5, 1000)).isEmpty();
        // 最後一頁不足 topK
        assertEquals(2, m.findCandidates("rice", 5, 10).size());
    }

    @Test void resolve_reports_next_offset() {
        FoodNameMatcher m = new FoodNameMatcher(CORPUS, new TrigramEmbeddingModel(), 32);

        FoodMatchResult p1 = m.resolve("ryce", 5, 0);
        assertFalse(p1.isExact());
        assertEquals(MatchMode.EMBEDDING, p1.mode());
        assertEquals(5, p1.candidates().size());
        assertEquals(5, p1.nextOffset());

        FoodMatchResult last = m.resolve("ryce", 5, 10);
        assertEquals(2, last.candidates().size());
        assertNull(last.nextOffset());
    }

    @Test void exact_match_skips_similarity_search() {
        TrigramEmbeddingModel model = new TrigramEmbeddingModel();
        FoodNameMatcher m = new FoodNameMatcher(CORPUS, model, 32);

        FoodMatchResult r = m.resolve("  Cabbage   CRUCIFEROUS boiled", 5, 0);
        assertTrue(r.isExact());
        assertEquals("cabbage cruciferous boiled", r.exactMatch());
        assertEquals(MatchMode.EXACT, r.mode());
        assertThat(r.candidates()).isEmpty();
        assertEquals(0, model.queryCalls());
    }

    @Test void exact_match_with_mocked_model() {
        EmbeddingModel model = mock(EmbeddingModel.class);
        when(model.embedAll(anyList())).thenAnswer(inv -> {
            List<TextSegment> segs = inv.getArgument(0);
            List<Embedding> out = new ArrayList<>();
            for (int i = 0; i < segs.size(); i++) out.add(Embedding.from(new float[]{1f, 0f}));
            return Response.from(out);
        });
        FoodNameMatcher m = new FoodNameMatcher(List.of("apple raw", "banana ripe"), model, 32);
        clearInvocations(model);

        assertEquals("apple raw", m.resolveExact("APPLE RAW").orElseThrow());
        assertTrue(m.resolve("Apple Raw", 5, 0).isExact());
        verifyNoInteractions(model);
    }

    @Test void blank_query_is_empty() {
        FoodNameMatcher m = new FoodNameMatcher(CORPUS, new TrigramEmbeddingModel(), 32);
        assertThat(m.findCandidates("", 5, 0)).isEmpty();
        assertThat(m.findCandidates("   ", 5, 0)).isEmpty();
        assertThat(m.findCandidates(null, 5, 0)).isEmpty();
        assertTrue(m.resolveExact("  ").isEmpty());
    }

    @Test void invalid_paging_rejected() {
        FoodNameMatcher m = new FoodNameMatcher(CORPUS);
        assertThrows(IllegalArgumentException.class, () -> m.findCandidates("rice", 0, 0));
        assertThrows(IllegalArgumentException.class, () -> m.findCandidates("rice", 5, -1));
        assertThrows(IllegalArgumentException.class, () -> m.resolve("ryce", 0, 0));
    }

    // ===== fallback =====

    @Test void corpus_embedding_failure_falls_back_to_substring() {
        EmbeddingModel broken = mock(EmbeddingModel.class);
        when(broken.embedAll(anyList())).thenThrow(new IllegalStateException("onnx runtime missing"));

        FoodNameMatcher m = new FoodNameMatcher(CORPUS, broken, 32);
        assertFalse(m.embeddingsEnabled());

        FoodMatchResult r = m.resolve("bread", 5, 0);
        assertEquals(MatchMode.SUBSTRING, r.mode());
        assertThat(names(r.candidates())).containsExactlyInAnyOrder("white bread", "whole wheat bread");
    }

    @Test void batch_size_mismatch_falls_back_to_substring() {
        EmbeddingModel shortReply = mock(EmbeddingModel.class);
        when(shortReply.embedAll(anyList())).thenReturn(Response.from(List.of(Embedding.from(new float[]{1f}))));

        FoodNameMatcher m = new FoodNameMatcher(CORPUS, shortReply, 32);
        assertFalse(m.embeddingsEnabled());
    }

    @Test void query_embedding_failure_uses_substring_for_that_query() {
        TrigramEmbeddingModel flaky = new TrigramEmbeddingModel() {
            @Override
            public Response<Embedding> embed(String text) {
                throw new IllegalStateException("timeout");
            }
        };
        FoodNameMatcher m = new FoodNameMatcher(CORPUS, flaky, 32);
        assertTrue(m.embeddingsEnabled());

        FoodMatchResult r = m.resolve("bread", 5, 0);
        assertEquals(MatchMode.SUBSTRING, r.mode());
        assertEquals(2, r.candidates().size());
        assertNull(r.nextOffset());
    }

    // ===== substring mode =====

    @Test void substring_scores_by_length_ratio() {
        FoodNameMatcher m = new FoodNameMatcher(List.of("white rice boiled", "rice", "brown rice", "apple raw"));
        assertFalse(m.embeddingsEnabled());

        List<FoodCandidate> c = m.findCandidates("RICE", 10, 0);
        assertEquals(List.of("rice", "brown rice", "white rice boiled"), c.stream().map(FoodCandidate::name).toList());
        assertEquals(1.0, c.get(0).score(), 1e-12);
        assertEquals(0.4, c.get(1).score(), 1e-12);
        assertEquals(4.0 / 17.0, c.get(2).score(), 1e-12);
    }

    @Test void substring_ties_keep_corpus_order() {
        FoodNameMatcher m = new FoodNameMatcher(List.of("rice b", "rice a", "rice c"));
        assertEquals(List.of("rice b", "rice a", "rice c"),
                m.findCandidates("rice", 10, 0).stream().map(FoodCandidate::name).toList());
    }

    @Test void substring_query_is_not_trimmed() {
        FoodNameMatcher m = new FoodNameMatcher(List.of("rice", "brown rice", "white rice boiled"));
        assertEquals(List.of("brown rice", "white rice boiled"),
                m.findCandidates(" rice", 10, 0).stream().map(FoodCandidate::name).toList());
    }

    @Test void substring_no_match_is_empty_not_error() {
        FoodNameMatcher m = new FoodNameMatcher(CORPUS);
        FoodMatchResult r = m.resolve("pizza", 5, 0);
        assertThat(r.candidates()).isEmpty();
        assertNull(r.nextOffset());
    }

    @Test void huge_offset_has_no_next_page() {
        FoodNameMatcher m = new FoodNameMatcher(List.of("rice a", "rice b", "rice c"));
        FoodMatchResult r = m.resolve("rice", 5, Integer.MAX_VALUE);
        assertThat(r.candidates()).isEmpty();
        assertNull(r.nextOffset());

        FoodNameMatcher e = new FoodNameMatcher(CORPUS, new TrigramEmbeddingModel(), 32);
        FoodMatchResult er = e.resolve("ryce", Integer.MAX_VALUE, 1);
        assertEquals(CORPUS.size() - 1, er.candidates().size());
        assertNull(er.nextOffset());
    }

    @Test void substring_paging() {
        FoodNameMatcher m = new FoodNameMatcher(CORPUS);
        // 5 筆含 "rice"
        FoodMatchResult p1 = m.resolve("rice", 3, 0);
        FoodMatchResult p2 = m.resolve("rice", 3, 3);
        assertEquals(3, p1.candidates().size());
        assertEquals(3, p1.nextOffset());
        assertEquals(2, p2.candidates().size());
        assertNull(p2.nextOffset());
        assertThat(names(p1.candidates())).doesNotContainAnyElementsOf(names(p2.candidates()));
    }

    @Test void unit_vector() {
        float[] u = FoodNameMatcher.unit(new float[]{3f, 4f});
        assertEquals(0.6f, u[0], 1e-6f);
        assertEquals(0.8f, u[1], 1e-6f);
        assertArrayEquals(new float[]{0f, 0f}, FoodNameMatcher.unit(new float[]{0f, 0f}));
    }

    private static Set<String> names(List<FoodCandidate> cs) {
        Set<String> out = new HashSet<>();
        for (FoodCandidate c : cs) out.add(c.name());
        return out;
    }
}
