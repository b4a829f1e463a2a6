package com.imperium.lexi.service.impl;

import com.imperium.lexi.config.ContextRetrievalProperties;
import com.imperium.lexi.exception.EmbeddingException;
import com.imperium.lexi.model.dto.context.ContextMessage;
import com.imperium.lexi.model.dto.context.MessageEmbeddingEntry;
import com.imperium.lexi.model.dto.context.RelevantContextQuery;
import com.imperium.lexi.model.dto.context.SimilarContextQuery;
import com.imperium.lexi.model.dto.context.SimilarMessage;
import com.imperium.lexi.model.entity.MessageEmbedding;
import com.imperium.lexi.support.FakeEmbeddingService;
import com.imperium.lexi.support.InMemoryMessageEmbeddingStore;
import com.imperium.lexi.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ContextServiceImplTest {

    private static final String USER = "user-1";
    private static final String CONV = "conv-1";

    private FakeEmbeddingService embeddings;
    private InMemoryMessageEmbeddingStore store;
    private CacheServiceImpl cache;
    private MutableClock clock;
    private Scheduler scheduler;
    private ContextRetrievalProperties properties;
    private ContextServiceImpl service;

    @BeforeEach
    void setUp() {
        embeddings = new FakeEmbeddingService()
                .register("A1 payment terms net 30", 1f, 0.1f, 0f)
                .register("A2 late payment penalties", 0.9f, 0.3f, 0f)
                .register("B1 governing law is Delaware", 0f, 1f, 0.1f)
                .register("B2 disputes go to arbitration", 0.1f, 0.9f, 0.2f)
                .register("C1 confidentiality survives termination", 0f, 0f, 1f)
                .register("when is payment due?", 1f, 0.05f, 0f)
                .register("how long does confidentiality last?", 0f, 0f, 1f);
        store = new InMemoryMessageEmbeddingStore();
        clock = new MutableClock(Instant.parse("2024-03-01T09:00:00Z"));
        cache = new CacheServiceImpl(clock, 100);
        scheduler = Schedulers.newBoundedElastic(4, 100, "context-test");
        properties = new ContextRetrievalProperties();
        service = new ContextServiceImpl(embeddings, store, cache, scheduler, clock, properties);
    }

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    // ==================== 写入 ====================

    @Test
    void storesEmbeddingWithDefaultMetadataType() {
        Optional<MessageEmbedding> stored = service.storeMessageEmbedding(entry("m1", "user", "A1 payment terms net 30"));

        assertTrue(stored.isPresent());
        assertEquals("chat", stored.get().getMetadata().get("type"));
        assertEquals("openai", stored.get().getEmbeddingProvider());
        assertEquals(LocalDateTime.of(2024, 3, 1, 9, 0), stored.get().getCreatedAt());
        assertEquals(1, store.records().size());
    }

    @Test
    void skipsSystemAndUnknownRoles() {
        assertTrue(service.storeMessageEmbedding(entry("m1", "system", "A1 payment terms net 30")).isEmpty());
        assertTrue(service.storeMessageEmbedding(entry("m2", "tool", "A1 payment terms net 30")).isEmpty());
        assertEquals(0, store.records().size());
        assertEquals(0, embeddings.calls());
    }

    @Test
    void rejectsUnsupportedMetadataType() {
        MessageEmbeddingEntry entry = entry("m1", "assistant", "A1 payment terms net 30");
        entry.setMetadata(Map.of("type", "poem"));

        assertTrue(service.storeMessageEmbedding(entry).isEmpty());
        assertEquals(0, store.records().size());
    }

    @Test
    void embeddingFailureYieldsEmptyResult() {
        assertTrue(service.storeMessageEmbedding(entry("m1", "user", "text nobody registered")).isEmpty());
        assertTrue(service.storeMessageEmbedding(null).isEmpty());
    }

    @Test
    void storageFailureYieldsEmptyResult() {
        store.failAll(true);
        assertTrue(service.storeMessageEmbedding(entry("m1", "user", "A1 payment terms net 30")).isEmpty());
    }

    @Test
    void batchStoresSurvivorsOnly() {
        List<MessageEmbedding> stored = service.storeMessageEmbeddingsBatch(List.of(
                entry("m1", "user", "A1 payment terms net 30"),
                entry("m2", "assistant", "unregistered text"),
                entry("m3", "system", "B1 governing law is Delaware"),
                entry("m4", "assistant", "B1 governing law is Delaware")));

        assertEquals(2, stored.size());
        assertEquals(2, store.records().size());
        assertTrue(service.storeMessageEmbeddingsBatch(List.of()).isEmpty());
    }

    // ==================== 检索 ====================

    @Test
    void topicQueryReturnsOnlyMatchingTopicMostSimilarFirst() {
        storeFiveTopics();

        List<SimilarMessage> results = service.findSimilarContext("when is payment due?", query(2, 0.7));

        assertEquals(List.of("m1", "m2"), results.stream().map(SimilarMessage::getMessageId).toList());
        assertTrue(results.get(0).getSimilarity() > results.get(1).getSimilarity());
        assertTrue(results.get(1).getSimilarity() >= 0.7);
    }

    @Test
    void degradedPathRanksTheSameWay() {
        storeFiveTopics();
        properties.setNativeSearchEnabled(false);

        List<SimilarMessage> results = service.findSimilarContext("when is payment due?", query(2, 0.7));

        assertEquals(List.of("m1", "m2"), results.stream().map(SimilarMessage::getMessageId).toList());
        assertEquals(0, store.nativeSearches());
    }

    @Test
    void nativeSearchErrorFallsBackToInProcessScan() {
        storeFiveTopics();
        store.failNativeSearch(true);

        List<SimilarMessage> results = service.findSimilarContext("when is payment due?", query(5, 0.7));

        assertEquals(List.of("m1", "m2"), results.stream().map(SimilarMessage::getMessageId).toList());
        assertEquals(1, store.nativeSearches());
    }

    @Test
    void respectsThresholdAndLimit() {
        storeFiveTopics();

        assertEquals(1, service.findSimilarContext("when is payment due?", query(5, 0.99)).size());
        assertEquals(1, service.findSimilarContext("when is payment due?", query(1, 0.0)).size());
        assertEquals(5, service.findSimilarContext("when is payment due?", query(10, -1.0)).size());
    }

    @Test
    void honoursExclusionsAndUserScope() {
        storeFiveTopics();
        MessageEmbeddingEntry foreign = entry("x1", "user", "A1 payment terms net 30");
        foreign.setUserId("user-2");
        service.storeMessageEmbedding(foreign);

        SimilarContextQuery q = query(5, 0.7);
        q.setExcludeMessageIds(List.of("m1"));

        List<SimilarMessage> results = service.findSimilarContext("when is payment due?", q);
        assertEquals(List.of("m2"), results.stream().map(SimilarMessage::getMessageId).toList());
    }

    @Test
    void failedDegradedPathReturnsEmptyList() {
        storeFiveTopics();
        store.failAll(true);

        assertTrue(service.findSimilarContext("when is payment due?", query(2, 0.7)).isEmpty());
    }

    @Test
    void invalidQueriesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> service.findSimilarContext(" ", query(2, 0.7)));
        SimilarContextQuery noUser = query(2, 0.7);
        noUser.setUserId(null);
        assertThrows(IllegalArgumentException.class, () -> service.findSimilarContext("when is payment due?", noUser));
    }

    @Test
    void queryEmbeddingIsCached() {
        storeFiveTopics();
        int before = embeddings.calls();

        service.findSimilarContext("when is payment due?", query(2, 0.7));
        service.findSimilarContext("when is payment due?", query(2, 0.7));

        assertEquals(before + 1, embeddings.calls());
    }

    @Test
    void embeddingExhaustionPropagates() {
        storeFiveTopics();

        assertThrows(EmbeddingException.class,
                () -> service.findSimilarContext("a query nobody can embed", query(2, 0.7)));
    }

    @Test
    void fallbackQueryEmbeddingIsNotCached() {
        storeFiveTopics();
        embeddings.servedBy("google");
        int before = embeddings.calls();

        service.findSimilarContext("when is payment due?", query(2, 0.7));
        service.findSimilarContext("when is payment due?", query(2, 0.7));

        assertEquals(before + 2, embeddings.calls());
    }

    @Test
    void metadataFilterAppliesOnNativePath() {
        storeTopicsWithTypes();

        assertEquals(List.of("m1", "m2"), ids(service.findSimilarContext("when is payment due?", typed("analyze"))));
        assertEquals(List.of("m3", "m4", "m5"), sorted(service.findSimilarContext("when is payment due?", typed("chat"))));
        assertTrue(store.nativeSearches() > 0);
    }

    @Test
    void metadataFilterAppliesOnDegradedPath() {
        storeTopicsWithTypes();
        properties.setNativeSearchEnabled(false);

        assertEquals(List.of("m1", "m2"), ids(service.findSimilarContext("when is payment due?", typed("analyze"))));
        assertEquals(List.of("m3", "m4", "m5"), sorted(service.findSimilarContext("when is payment due?", typed("chat"))));
        assertEquals(0, store.nativeSearches());
    }

    @Test
    void conversationScopeExcludesOtherConversations() {
        storeFiveTopics();
        MessageEmbeddingEntry elsewhere = entry("o1", "user", "A1 payment terms net 30");
        elsewhere.setConversationId("conv-2");
        assertTrue(service.storeMessageEmbedding(elsewhere).isPresent());

        List<String> scoped = ids(service.findSimilarContext("when is payment due?", query(5, 0.7)));
        assertEquals(List.of("m1", "m2"), scoped);

        SimilarContextQuery allConversations = query(5, 0.7);
        allConversations.setConversationId(null);
        assertTrue(ids(service.findSimilarContext("when is payment due?", allConversations)).contains("o1"));

        properties.setNativeSearchEnabled(false);
        assertEquals(List.of("m1", "m2"), ids(service.findSimilarContext("when is payment due?", query(5, 0.7))));
    }

    @Test
    void relevantContextDeduplicatesAndKeepsSemanticCopy() {
        storeFiveTopics();

        List<ContextMessage> context = service.getRelevantContext("how long does confidentiality last?",
                RelevantContextQuery.builder().userId(USER).conversationId(CONV).build());

        assertEquals(List.of("m3", "m4", "m5"), context.stream().map(ContextMessage::getMessageId).toList());
        ContextMessage confidentiality = context.get(2);
        assertEquals(ContextMessage.SOURCE_SEMANTIC, confidentiality.getSource());
        assertEquals(1.0, confidentiality.getSimilarity(), 1e-6);
        assertNull(context.get(0).getSimilarity());
    }

    @Test
    void relevantContextIsChronological() {
        storeFiveTopics();

        List<ContextMessage> context = service.getRelevantContext("when is payment due?",
                RelevantContextQuery.builder().userId(USER).conversationId(CONV).build());

        assertEquals(List.of("m1", "m2", "m3", "m4", "m5"), context.stream().map(ContextMessage::getMessageId).toList());
    }

    @Test
    void semanticFailureStillReturnsRecentMessages() {
        storeFiveTopics();

        List<ContextMessage> context = service.getRelevantContext("a query nobody can embed",
                RelevantContextQuery.builder().userId(USER).conversationId(CONV).recentLimit(2).build());

        assertEquals(List.of("m4", "m5"), context.stream().map(ContextMessage::getMessageId).toList());
        assertTrue(context.stream().allMatch(m -> ContextMessage.SOURCE_RECENT.equals(m.getSource())));
    }

    @Test
    void relevantContextNeverThrows() {
        store.failAll(true);
        assertTrue(service.getRelevantContext("when is payment due?",
                RelevantContextQuery.builder().userId(USER).build()).isEmpty());
        assertTrue(service.getRelevantContext("when is payment due?", null).isEmpty());
    }

    @Test
    void mergeDeduplicatesByContentPrefix() {
        String shared = "x".repeat(100);
        ContextMessage recent = ContextMessage.builder().messageId("r").content(shared + " recent tail")
                .timestamp(LocalDateTime.of(2024, 1, 1, 10, 0)).source(ContextMessage.SOURCE_RECENT).build();
        ContextMessage semantic = ContextMessage.builder().messageId("s").content(shared + " semantic tail")
                .similarity(0.9).timestamp(LocalDateTime.of(2024, 1, 1, 9, 0)).source(ContextMessage.SOURCE_SEMANTIC).build();

        List<ContextMessage> merged = ContextServiceImpl.merge(List.of(recent), List.of(semantic), 100);

        assertEquals(1, merged.size());
        assertEquals("s", merged.get(0).getMessageId());
    }

    // ==================== 删除 ====================

    @Test
    void deletesByConversationAndMessage() {
        storeFiveTopics();

        assertTrue(service.deleteMessageEmbedding("m1"));
        assertFalse(service.deleteMessageEmbedding("m1"));
        assertEquals(4, service.deleteConversationEmbeddings(CONV));
        assertEquals(0, store.records().size());
    }

    @Test
    void deleteErrorsAreSwallowed() {
        store.failAll(true);
        assertEquals(0, service.deleteConversationEmbeddings(CONV));
        assertFalse(service.deleteMessageEmbedding("m1"));
    }

    private void storeFiveTopics() {
        String[][] messages = {
                {"m1", "user", "A1 payment terms net 30"},
                {"m2", "assistant", "A2 late payment penalties"},
                {"m3", "user", "B1 governing law is Delaware"},
                {"m4", "assistant", "B2 disputes go to arbitration"},
                {"m5", "user", "C1 confidentiality survives termination"}
        };
        for (String[] m : messages) {
            assertTrue(service.storeMessageEmbedding(entry(m[0], m[1], m[2])).isPresent());
            clock.advance(Duration.ofMinutes(1));
        }
    }

    private void storeTopicsWithTypes() {
        String[][] messages = {
                {"m1", "A1 payment terms net 30", "analyze"},
                {"m2", "A2 late payment penalties", "analyze"},
                {"m3", "B1 governing law is Delaware", "chat"},
                {"m4", "B2 disputes go to arbitration", "chat"},
                {"m5", "C1 confidentiality survives termination", "chat"}
        };
        for (String[] m : messages) {
            MessageEmbeddingEntry e = entry(m[0], "user", m[1]);
            e.setMetadata(Map.of("type", m[2]));
            assertTrue(service.storeMessageEmbedding(e).isPresent());
            clock.advance(Duration.ofMinutes(1));
        }
    }

    private static SimilarContextQuery typed(String type) {
        SimilarContextQuery q = query(10, -1.0);
        q.setMetadataFilter(Map.of("type", type));
        return q;
    }

    private static List<String> ids(List<SimilarMessage> results) {
        return results.stream().map(SimilarMessage::getMessageId).toList();
    }

    private static List<String> sorted(List<SimilarMessage> results) {
        return results.stream().map(SimilarMessage::getMessageId).sorted().toList();
    }

    private static MessageEmbeddingEntry entry(String messageId, String role, String content) {
        return MessageEmbeddingEntry.builder()
                .userId(USER)
                .conversationId(CONV)
                .messageId(messageId)
                .role(role)
                .content(content)
                .build();
    }

    private static SimilarContextQuery query(int limit, double threshold) {
        return SimilarContextQuery.builder()
                .userId(USER)
                .conversationId(CONV)
                .limit(limit)
                .threshold(threshold)
                .build();
    }
}
