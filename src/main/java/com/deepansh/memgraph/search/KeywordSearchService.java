package com.deepansh.memgraph.search;

import com.deepansh.memgraph.model.EntityKey;
import com.deepansh.memgraph.model.Fact;
import com.deepansh.memgraph.model.Note;
import com.deepansh.memgraph.store.FactStore;
import com.deepansh.memgraph.store.NoteStore;
import com.deepansh.memgraph.store.WorkspaceLayout;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Local keyword path of hybrid retrieval.
 *
 * Scans active facts and the summary of every entity, then every daily note.
 * Fact hits carry the full fact text; summary and note hits carry a snippet.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class KeywordSearchService {

    static final Comparator<SearchResult> BY_SCORE_THEN_NEWEST =
            Comparator.comparingDouble(SearchResult::getScore).reversed()
                    .thenComparing((SearchResult r) -> r.getTimestamp() == null ? "" : r.getTimestamp(),
                            Comparator.reverseOrder());

    private final FactStore factStore;
    private final NoteStore noteStore;
    private final WorkspaceLayout layout;
    private final KeywordScorer scorer;

    public List<SearchResult> search(String query, int limit) {
        List<SearchResult> results = new ArrayList<>();

        for (EntityKey entity : factStore.listEntities()) {
            for (Fact fact : factStore.load(entity)) {
                if (!fact.isActive() || fact.getFact() == null) {
                    continue;
                }
                double score = scorer.score(fact.getFact(), query);
                if (score > 0) {
                    results.add(SearchResult.builder()
                            .type(ResultType.ENTITY_FACT)
                            .entity(entity.toString())
                            .content(fact.getFact())
                            .score(score)
                            .timestamp(fact.getTimestamp() == null ? "" : fact.getTimestamp())
                            .category(fact.getCategory() == null ? "" : fact.getCategory())
                            .source(factStore.sourceOf(entity, fact.getId()))
                            .build());
                }
            }

            Optional<String> summary = factStore.readSummary(entity);
            if (summary.isPresent()) {
                double score = scorer.score(summary.get(), query);
                if (score > 0) {
                    results.add(SearchResult.builder()
                            .type(ResultType.ENTITY_SUMMARY)
                            .entity(entity.toString())
                            .content(scorer.snippet(summary.get(), query))
                            .score(score)
                            .timestamp("")
                            .category("summary")
                            .source(layout.relative(layout.summaryFile(entity)))
                            .build());
                }
            }
        }

        for (Note note : noteStore.listNotes()) {
            double score = scorer.score(note.content(), query);
            if (score > 0) {
                results.add(SearchResult.builder()
                        .type(ResultType.DAILY_NOTE)
                        .entity(note.date())
                        .content(scorer.snippet(note.content(), query))
                        .score(score)
                        .timestamp(note.date())
                        .category("daily_event")
                        .source(note.path())
                        .build());
            }
        }

        results.sort(BY_SCORE_THEN_NEWEST);
        log.debug("Keyword search '{}' matched {} items", query, results.size());
        return results.size() > limit ? new ArrayList<>(results.subList(0, limit)) : results;
    }
}
