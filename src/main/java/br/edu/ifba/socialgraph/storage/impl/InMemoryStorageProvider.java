package br.edu.ifba.socialgraph.storage.impl;

import org.jboss.logging.Logger;

import br.edu.ifba.socialgraph.storage.GraphStore;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

/**
 * Produces the in-memory {@link GraphStore}. Active when
 * {@code socialgraph.storage.backend=memory} or the property is absent.
 */
@ApplicationScoped
@IfBuildProperty(name = "socialgraph.storage.backend", stringValue = "memory", enableIfMissing = true)
public class InMemoryStorageProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryStorageProvider.class);

    private InMemoryGraphStore graphStore;

    @Produces
    @ApplicationScoped
    @IfBuildProperty(name = "socialgraph.storage.backend", stringValue = "memory", enableIfMissing = true)
    public GraphStore produceGraphStore() {
        if (graphStore == null) {
            graphStore = new InMemoryGraphStore();
            graphStore.initialize().join();
            LOG.info("Using in-memory graph store");
        }
        return graphStore;
    }

    @PreDestroy
    void shutdown() {
        if (graphStore != null) {
            graphStore.close();
        }
    }
}
