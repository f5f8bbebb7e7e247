package me.golemcore.hindsight.domain.entity;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.hindsight.domain.model.EntityMention;
import me.golemcore.hindsight.domain.service.TextSupport;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Canonical forms and similarity of entity names.
 */
public final class EntityNames {

    private EntityNames() {
    }

    /**
     * Lower-case, accent-free, punctuation-free name without a leading
     * article.
     */
    public static String canonicalize(String name) {
        String normalized = TextSupport.normalize(name);
        if (normalized.startsWith("the ") && normalized.length() > 4) {
            normalized = normalized.substring(4);
        }
        return normalized;
    }

    /**
     * Similarity of two canonical names in {@code [0, 1]}: the larger of token
     * Jaccard overlap and normalized edit-distance similarity.
     */
    public static double similarity(String leftCanonical, String rightCanonical) {
        if (leftCanonical.isEmpty() || rightCanonical.isEmpty()) {
            return 0.0;
        }
        if (leftCanonical.equals(rightCanonical)) {
            return 1.0;
        }
        double tokenOverlap = TextSupport.jaccard(tokens(leftCanonical), tokens(rightCanonical));
        int maxLength = Math.max(leftCanonical.length(), rightCanonical.length());
        double editSimilarity = 1.0 - (double) levenshtein(leftCanonical, rightCanonical) / maxLength;
        return Math.max(tokenOverlap, editSimilarity);
    }

    /**
     * Types are compatible when equal or when either side is unknown.
     */
    public static boolean typesCompatible(String left, String right) {
        if (left == null || right == null
                || EntityMention.TYPE_OTHER.equalsIgnoreCase(left)
                || EntityMention.TYPE_OTHER.equalsIgnoreCase(right)) {
            return true;
        }
        return left.equalsIgnoreCase(right);
    }

    private static Set<String> tokens(String canonical) {
        return new LinkedHashSet<>(Arrays.asList(canonical.split(" ")));
    }

    static int levenshtein(String a, String b) {
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
}
