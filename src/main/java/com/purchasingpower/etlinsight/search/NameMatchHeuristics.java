package com.purchasingpower.etlinsight.search;

import com.purchasingpower.etlinsight.configuration.SearchProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Cheap sanity check applied to semantic candidates before their score is trusted.
 *
 * <p>A name is a reasonable match for a query when, compared case-insensitively:
 * <ul>
 *   <li>they are equal, or one contains the other</li>
 *   <li>they are equal once one configured prefix is stripped from each</li>
 *   <li>the stripped query is long enough and occurs inside the stripped name</li>
 * </ul>
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
public class NameMatchHeuristics {

    private final SearchProperties properties;

    public boolean isReasonableMatch(String query, String name) {
        if (query == null || name == null) {
            return false;
        }
        String q = query.trim().toLowerCase(Locale.ROOT);
        String n = name.trim().toLowerCase(Locale.ROOT);
        if (q.isEmpty() || n.isEmpty()) {
            return false;
        }

        if (q.equals(n) || n.contains(q) || q.contains(n)) {
            return true;
        }

        String strippedQuery = stripPrefix(q);
        String strippedName = stripPrefix(n);
        if (strippedQuery.equals(strippedName)) {
            return true;
        }

        return strippedQuery.length() >= properties.getSignificantPartMinLength()
            && strippedName.contains(strippedQuery);
    }

    /**
     * Removes the first configured prefix the (lower-cased) value starts with.
     */
    String stripPrefix(String value) {
        for (String prefix : properties.getStripPrefixes()) {
            String p = prefix.toLowerCase(Locale.ROOT);
            if (!p.isEmpty() && value.startsWith(p)) {
                return value.substring(p.length());
            }
        }
        return value;
    }
}
