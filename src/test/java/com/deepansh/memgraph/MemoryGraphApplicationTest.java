package com.deepansh.memgraph;

import com.deepansh.memgraph.search.HybridSearchService;
import com.deepansh.memgraph.search.ResilientSemanticSearchClient;
import com.deepansh.memgraph.search.SemanticSearchClient;
import org.junit.jupiter.api.Test;
import org.springframework.aop.support.AopUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "memory.workspace-dir=target/test-workspace",
        "memory.semantic-search.enabled=false"
})
class MemoryGraphApplicationTest {

    @Autowired SemanticSearchClient semanticSearchClient;
    @Autowired HybridSearchService hybridSearchService;

    @Test
    void contextLoads_withResilientClientAsPrimary() {
        assertThat(AopUtils.getTargetClass(semanticSearchClient)).isEqualTo(ResilientSemanticSearchClient.class);
    }

    @Test
    void search_emptyWorkspace_returnsNothing() {
        assertThat(hybridSearchService.search("acme", 5, null, null, null)).isEmpty();
    }
}
