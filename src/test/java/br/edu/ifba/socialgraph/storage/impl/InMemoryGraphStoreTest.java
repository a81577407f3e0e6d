package br.edu.ifba.socialgraph.storage.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import br.edu.ifba.socialgraph.storage.GraphStore;

class InMemoryGraphStoreTest extends GraphStoreContractTest {

    private InMemoryGraphStore graphStore;

    @BeforeEach
    void setUp() {
        graphStore = new InMemoryGraphStore();
        graphStore.initialize().join();
    }

    @AfterEach
    void tearDown() {
        graphStore.close();
    }

    @Override
    protected GraphStore store() {
        return graphStore;
    }

    @Test
    void testRejectsUseBeforeInitialize() {
        InMemoryGraphStore fresh = new InMemoryGraphStore();

        assertThrows(IllegalStateException.class, () -> fresh.upsertNode(user("octocat")));
    }

    @Test
    void testCloseDropsAllData() {
        stored(user("octocat"));
        graphStore.close();
        graphStore.initialize().join();

        assertEquals(0L, graphStore.countNodes().join());
    }
}
