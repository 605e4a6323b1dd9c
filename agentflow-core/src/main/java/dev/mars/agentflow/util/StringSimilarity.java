/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.agentflow.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Edit-distance helpers used to produce "did you mean" suggestions.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class StringSimilarity {

    private StringSimilarity() {
    }

    /**
     * Computes the Levenshtein distance between two strings.
     */
    public static int levenshtein(String a, String b) {
        Objects.requireNonNull(a, "First string cannot be null");
        Objects.requireNonNull(b, "Second string cannot be null");

        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }

        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    /**
     * Ranks candidates by edit distance to {@code target}, closest first, ties
     * broken alphabetically. Comparison is case-insensitive.
     *
     * @param target     the unrecognized input
     * @param candidates the valid values
     * @param limit      maximum number of suggestions to return
     * @return ranked suggestions, empty when there are no candidates
     */
    public static List<String> closestMatches(String target, Collection<String> candidates, int limit) {
        String normalized = target == null ? "" : target.toLowerCase();
        List<String> ranked = new ArrayList<>(candidates);
        ranked.sort(Comparator.<String>comparingInt(c -> levenshtein(normalized, c.toLowerCase()))
                .thenComparing(Comparator.naturalOrder()));
        return ranked.size() > limit ? List.copyOf(ranked.subList(0, limit)) : List.copyOf(ranked);
    }

    /**
     * Like {@link #closestMatches(String, Collection, int)} but drops candidates
     * further than {@code maxDistance} edits away.
     */
    public static List<String> closestMatches(String target, Collection<String> candidates,
                                              int limit, int maxDistance) {
        String normalized = target == null ? "" : target.toLowerCase();
        List<String> within = new ArrayList<>();
        for (String candidate : candidates) {
            if (levenshtein(normalized, candidate.toLowerCase()) <= maxDistance) {
                within.add(candidate);
            }
        }
        return closestMatches(target, within, limit);
    }
}
