package io.factorialsystems.oauthserver.service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Helpers for space-delimited scope strings.
 */
public final class Scopes {

    private Scopes() {
    }

    /**
     * Splits a scope parameter into an ordered, de-duplicated set. Null or blank yields an empty set.
     */
    public static Set<String> parse(String scope) {
        if (scope == null || scope.isBlank()) {
            return new LinkedHashSet<>();
        }
        return Arrays.stream(scope.trim().split("\\s+"))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public static String format(Collection<String> scopes) {
        return scopes == null ? "" : String.join(" ", scopes);
    }

    public static boolean isSubset(Collection<String> candidate, Collection<String> allowed) {
        return allowed != null && allowed.containsAll(candidate);
    }

    /**
     * Elements of {@code requested} that are also in {@code allowed}, in request order.
     */
    public static List<String> intersect(Collection<String> requested, Collection<String> allowed) {
        return requested.stream()
                .filter(allowed::contains)
                .collect(Collectors.toList());
    }
}
