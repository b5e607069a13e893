package com.scholar.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholar.corpus.Author;
import com.scholar.corpus.CorpusIndex;
import com.scholar.corpus.CorpusLoadException;
import com.scholar.corpus.PublicationRecord;
import com.scholar.search.RankedDocument;
import com.scholar.search.ScholarSearchService;
import com.scholar.search.SearchResult;
import com.scholar.search.SortField;
import com.scholar.search.SortOrder;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(SearchController.class)
class SearchControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ScholarSearchService searchService;

    @Test
    void healthReportsIndexState() throws Exception {
        when(searchService.currentIndex()).thenReturn(CorpusIndex.empty());
        when(searchService.cachedQueries()).thenReturn(3);

        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"))
            .andExpect(jsonPath("$.publications").value(0))
            .andExpect(jsonPath("$.cache_entries").value(3));
    }

    @Test
    void searchReturnsHits() throws Exception {
        PublicationRecord record = new PublicationRecord(
            "Machine Learning in Healthcare",
            "https://example.org/1",
            List.of(new Author("Amelia Hart", "https://example.org/amelia")),
            "2023-03-14",
            LocalDate.of(2023, 3, 14),
            "clinical decision support"
        );
        SearchResult result = new SearchResult(
            List.of(new RankedDocument(record, 0.82)), 1, 1, 1, 10, true, SortField.RELEVANCE, SortOrder.DESC
        );
        when(searchService.search(eq("machine learning"), eq(1), eq(10), any(), any())).thenReturn(result);

        mockMvc.perform(get("/search")
                .param("query", "machine learning")
                .param("page", "1")
                .param("size", "10")
                .header("x-trace-id", "trace-1")
                .header("x-request-id", "req-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.trace_id").value("trace-1"))
            .andExpect(jsonPath("$.request_id").value("req-1"))
            .andExpect(jsonPath("$.total").value(1))
            .andExpect(jsonPath("$.from_cache").value(true))
            .andExpect(jsonPath("$.sort_by").value("relevance"))
            .andExpect(jsonPath("$.results[0].title").value("Machine Learning in Healthcare"))
            .andExpect(jsonPath("$.results[0].authors[0].name").value("Amelia Hart"))
            .andExpect(jsonPath("$.results[0].published_date").value("2023-03-14"))
            .andExpect(jsonPath("$.results[0].abstract").value("clinical decision support"))
            .andExpect(jsonPath("$.results[0].score").value(0.82));
    }

    @Test
    void nonNumericPageIsBadRequest() throws Exception {
        mockMvc.perform(get("/search").param("page", "two"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("bad_request"));
    }

    @Test
    void failedReloadIsServiceUnavailable() throws Exception {
        when(searchService.reloadCorpus()).thenThrow(new CorpusLoadException("corpus not found"));

        mockMvc.perform(post("/internal/corpus/reload"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.error.code").value("corpus_unavailable"));
    }
}
