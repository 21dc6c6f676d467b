package com.deepansh.memgraph.api;

import com.deepansh.memgraph.dedup.ContentNormalizer;
import com.deepansh.memgraph.dedup.DeduplicationService;
import com.deepansh.memgraph.dedup.FactIngestionService;
import com.deepansh.memgraph.dedup.NearDuplicateDetector;
import com.deepansh.memgraph.exception.GlobalExceptionHandler;
import com.deepansh.memgraph.graph.EntityNameMentionExtractorFactory;
import com.deepansh.memgraph.graph.RelationshipDetector;
import com.deepansh.memgraph.graph.RelationshipService;
import com.deepansh.memgraph.model.EntityKey;
import com.deepansh.memgraph.salience.SalienceScorer;
import com.deepansh.memgraph.salience.SalienceService;
import com.deepansh.memgraph.store.TestWorkspace;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Fact endpoints wired to real stores in a temp workspace.
 */
class FactControllerTest {

    @TempDir
    Path tempDir;

    private TestWorkspace ws;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        ws = new TestWorkspace(tempDir);
        DeduplicationService dedup = new DeduplicationService(new ContentNormalizer(), ws.indexStore,
                ws.factStore, ws.noteStore, ws.properties, TestWorkspace.CLOCK);
        FactIngestionService ingestion = new FactIngestionService(ws.factStore, dedup,
                new NearDuplicateDetector(ws.properties), TestWorkspace.CLOCK);
        SalienceService salience = new SalienceService(ws.factStore,
                new SalienceScorer(TestWorkspace.CLOCK, ws.properties), ws.properties, TestWorkspace.CLOCK);
        RelationshipService relationships = new RelationshipService(ws.relationshipStore,
                new RelationshipDetector(ws.factStore, ws.noteStore,
                        new EntityNameMentionExtractorFactory(), TestWorkspace.CLOCK),
                ws.factStore, ws.properties, TestWorkspace.CLOCK);

        mvc = MockMvcBuilders.standaloneSetup(
                        new FactController(ingestion, salience, relationships, ws.factStore))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void addFact_displayName_storedUnderNormalizedKey() throws Exception {
        mvc.perform(post("/api/v1/entities/{type}/{name}/facts", "people", "John Smith")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fact\": \"Works at Acme Corp\", \"category\": \"work\"}"))
                .andExpect(status().isCreated());

        assertThat(ws.factStore.listEntities()).containsExactly(new EntityKey("people", "john-smith"));
        assertThat(ws.root.resolve("life/areas/people/john-smith/items.json")).exists();
    }

    @Test
    void listFacts_displayNameAndStoredKey_resolveToSameEntity() throws Exception {
        mvc.perform(post("/api/v1/entities/{type}/{name}/facts", "people", "John Smith")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fact\": \"Works at Acme Corp\", \"category\": \"work\"}"))
                .andExpect(status().isCreated());

        mvc.perform(get("/api/v1/entities/{type}/{name}/facts", "people", "john-smith"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].fact").value("Works at Acme Corp"));
        mvc.perform(get("/api/v1/entities/{type}/{name}/facts", "People", "John Smith"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    void listFacts_unknownEntity_is404() throws Exception {
        mvc.perform(get("/api/v1/entities/{type}/{name}/facts", "people", "Nobody Here"))
                .andExpect(status().isNotFound());
    }
}
