package br.edu.ifba.socialgraph.storage;

import java.util.Locale;

import org.jetbrains.annotations.Nullable;

import br.edu.ifba.socialgraph.core.EntityRecord;
import br.edu.ifba.socialgraph.core.EntityType;
import br.edu.ifba.socialgraph.core.SourceType;

/**
 * Criteria for scanning stored nodes. {@code null} fields match everything.
 *
 * <p>Text matches are case-insensitive substring matches. {@code nameContains} looks at
 * the display name only; {@code textContains} at the display name or the entity id.</p>
 */
public record NodeFilter(
    @Nullable SourceType source,
    @Nullable EntityType entityType,
    @Nullable String nameContains,
    @Nullable String textContains
) {

    public static final NodeFilter ALL = new NodeFilter(null, null, null, null);

    public NodeFilter {
        nameContains = blankToNull(nameContains);
        textContains = blankToNull(textContains);
    }

    public static NodeFilter matchingText(String text) {
        return new NodeFilter(null, null, null, text);
    }

    public boolean matches(EntityRecord node) {
        if (source != null && node.getSource() != source) {
            return false;
        }
        if (entityType != null && node.getEntityType() != entityType) {
            return false;
        }
        if (nameContains != null && !containsIgnoreCase(node.getDisplayName(), nameContains)) {
            return false;
        }
        return textContains == null
            || containsIgnoreCase(node.getDisplayName(), textContains)
            || containsIgnoreCase(node.getEntityId(), textContains);
    }

    private static boolean containsIgnoreCase(String value, String fragment) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(fragment.toLowerCase(Locale.ROOT));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
