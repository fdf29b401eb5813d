// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thegraph.core;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Switches debug logging on per {@link Category}.
 *
 * <p>All categories are off by default. Toggling is thread-safe and takes effect for the next
 * logged event, including events of a pagination run already in progress.
 */
public final class GraphDebug {

    /**
     * What a debug line describes.
     */
    public enum Category {
        /** One GraphQL round trip made by the HTTP transport. */
        QUERY,
        /** Pagination progress: bootstrap, received pages, reorgs and run completion. */
        PAGE
    }

    private static final Set<Category> ENABLED = ConcurrentHashMap.newKeySet();

    private GraphDebug() {
    }

    public static boolean isEnabled(final Category category) {
        return ENABLED.contains(category);
    }

    /**
     * @return true if at least one category is enabled
     */
    public static boolean isAnyEnabled() {
        return !ENABLED.isEmpty();
    }

    public static void setEnabled(final Category category, final boolean enabled) {
        if (enabled) {
            ENABLED.add(category);
        } else {
            ENABLED.remove(category);
        }
    }

    /**
     * Turns every category on or off.
     */
    public static void setAllEnabled(final boolean enabled) {
        for (Category category : Category.values()) {
            setEnabled(category, enabled);
        }
    }
}
