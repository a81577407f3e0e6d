package br.edu.ifba.socialgraph.source;

import java.util.EnumMap;
import java.util.Map;

import org.jboss.logging.Logger;

import br.edu.ifba.socialgraph.core.SourceType;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

/**
 * Looks up the adapter for a source.
 */
@ApplicationScoped
public class SourceAdapterRegistry {

    private static final Logger LOG = Logger.getLogger(SourceAdapterRegistry.class);

    private final Map<SourceType, SourceAdapter> adapters = new EnumMap<>(SourceType.class);

    @Inject
    public SourceAdapterRegistry(Instance<SourceAdapter> discovered) {
        this((Iterable<SourceAdapter>) discovered);
    }

    public SourceAdapterRegistry(Iterable<? extends SourceAdapter> available) {
        for (SourceAdapter adapter : available) {
            SourceAdapter previous = adapters.put(adapter.source(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Two adapters registered for " + adapter.source());
            }
        }
        LOG.infof("Registered source adapters: %s", adapters.keySet());
    }

    public SourceAdapter forSource(SourceType source) {
        SourceAdapter adapter = adapters.get(source);
        if (adapter == null) {
            throw new IllegalArgumentException("No adapter available for source " + source.getValue());
        }
        return adapter;
    }
}
