package com.hsbc.mupages;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Decides which candidate wins when more than one of them is a registered template.
 * <p>Set with {@link TemplatePagesBuilder#withMatchPrecedence(MatchPrecedence)}</p>
 */
public enum MatchPrecedence {

    /**
     * The last registered candidate wins, so <code>about/index.html</code> is preferred over <code>about.html</code>.
     * This is the default.
     */
    LAST_MATCH {
        @Override
        Optional<String> select(List<String> candidates, Set<String> templateNames) {
            String matched = null;
            for (String candidate : candidates) {
                if (templateNames.contains(candidate)) {
                    matched = candidate;
                }
            }
            return Optional.ofNullable(matched);
        }
    },

    /**
     * The first registered candidate wins, so <code>about.html</code> is preferred over <code>about/index.html</code>.
     */
    FIRST_MATCH {
        @Override
        Optional<String> select(List<String> candidates, Set<String> templateNames) {
            for (String candidate : candidates) {
                if (templateNames.contains(candidate)) {
                    return Optional.of(candidate);
                }
            }
            return Optional.empty();
        }
    };

    abstract Optional<String> select(List<String> candidates, Set<String> templateNames);
}
