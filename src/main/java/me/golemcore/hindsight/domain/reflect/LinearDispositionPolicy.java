package me.golemcore.hindsight.domain.reflect;

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

import me.golemcore.hindsight.domain.model.DispositionTraits;
import me.golemcore.hindsight.domain.model.EntityMention;
import me.golemcore.hindsight.domain.model.MemoryUnit;
import me.golemcore.hindsight.domain.model.OpinionCandidate;
import me.golemcore.hindsight.domain.service.TextSupport;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Disposition policy with linear effects per trait step (traits run 1..5).
 *
 * <ul>
 * <li>Skepticism {@code S}: an opinion needs at least {@code 1 + (S - 1) / 2}
 * cited facts that were actually retrieved, and its confidence is multiplied
 * by {@code 1 - 0.1 * (S - 1)}.</li>
 * <li>Literalism {@code L}: at least {@code 0.1 + 0.15 * (L - 1)} of the
 * opinion's content words must appear in its cited facts.</li>
 * <li>Empathy {@code E}: opinions about people or relationships get priority
 * {@code confidence * (1 + 0.1 * (E - 1))} when the budget forces a
 * choice.</li>
 * </ul>
 */
@Component
public class LinearDispositionPolicy implements DispositionPolicy {

    private static final Set<String> RELATIONSHIP_WORDS = Set.of(
            "friend", "friends", "wife", "husband", "partner", "mother", "father", "mom", "dad", "sister",
            "brother", "son", "daughter", "colleague", "colleagues", "coworker", "boss", "family", "relationship",
            "married", "girlfriend", "boyfriend", "parents", "children", "kids", "team", "neighbor");

    @Override
    public List<OpinionDecision> evaluate(List<OpinionCandidate> candidates, DispositionTraits disposition,
            Map<String, MemoryUnit> retrievedFacts, int budget) {
        int skepticism = clamp(disposition.getSkepticism());
        int literalism = clamp(disposition.getLiteralism());
        int empathy = clamp(disposition.getEmpathy());

        double minEvidence = 1.0 + (skepticism - 1) / 2.0;
        double confidenceFactor = 1.0 - 0.1 * (skepticism - 1);
        double requiredGrounding = 0.1 + 0.15 * (literalism - 1);
        double empathyBoost = 1.0 + 0.1 * (empathy - 1);

        List<OpinionDecision> decisions = new ArrayList<>(candidates.size());
        for (OpinionCandidate candidate : candidates) {
            List<String> supporting = supportingIds(candidate, retrievedFacts);
            double confidence = clampUnit(candidate.getConfidence() * confidenceFactor);
            double priority = concernsPeople(candidate) ? confidence * empathyBoost : confidence;

            String reason = null;
            if (candidate.getText() == null || candidate.getText().isBlank()) {
                reason = "empty opinion";
            } else if (supporting.size() < minEvidence) {
                reason = "needs " + (int) Math.ceil(minEvidence) + " supporting fact(s), has " + supporting.size();
            } else {
                double grounding = grounding(candidate.getText(), supporting, retrievedFacts);
                if (grounding < requiredGrounding) {
                    reason = String.format("grounding %.2f below required %.2f", grounding, requiredGrounding);
                }
            }
            decisions.add(new OpinionDecision(candidate, reason == null, confidence, priority, supporting, reason));
        }
        return applyBudget(decisions, budget);
    }

    /**
     * Share of the opinion's content words that occur in its supporting
     * facts.
     */
    static double grounding(String opinion, List<String> supporting, Map<String, MemoryUnit> retrievedFacts) {
        Set<String> opinionTokens = TextSupport.tokenSet(opinion);
        if (opinionTokens.isEmpty()) {
            return 0.0;
        }
        Set<String> factTokens = new LinkedHashSet<>();
        for (String id : supporting) {
            factTokens.addAll(TextSupport.tokenSet(retrievedFacts.get(id).getText()));
        }
        long covered = opinionTokens.stream().filter(factTokens::contains).count();
        return (double) covered / opinionTokens.size();
    }

    private static List<OpinionDecision> applyBudget(List<OpinionDecision> decisions, int budget) {
        List<Integer> acceptedOrder = new ArrayList<>();
        for (int i = 0; i < decisions.size(); i++) {
            if (decisions.get(i).accepted()) {
                acceptedOrder.add(i);
            }
        }
        if (acceptedOrder.size() <= budget) {
            return decisions;
        }
        acceptedOrder.sort(Comparator.<Integer>comparingDouble(i -> decisions.get(i).priority()).reversed()
                .thenComparing(Comparator.<Integer>comparingDouble(i -> decisions.get(i).confidence()).reversed())
                .thenComparing(Comparator.naturalOrder()));
        List<OpinionDecision> result = new ArrayList<>(decisions);
        for (int rank = Math.max(0, budget); rank < acceptedOrder.size(); rank++) {
            int index = acceptedOrder.get(rank);
            OpinionDecision dropped = decisions.get(index);
            result.set(index, new OpinionDecision(dropped.candidate(), false, dropped.confidence(),
                    dropped.priority(), dropped.supportingUnitIds(), "over the per-call opinion budget"));
        }
        return result;
    }

    private static List<String> supportingIds(OpinionCandidate candidate, Map<String, MemoryUnit> retrievedFacts) {
        Set<String> ids = new LinkedHashSet<>();
        if (candidate.getSupportingUnitIds() != null) {
            for (String id : candidate.getSupportingUnitIds()) {
                if (id != null && retrievedFacts.containsKey(id)) {
                    ids.add(id);
                }
            }
        }
        return List.copyOf(ids);
    }

    private static boolean concernsPeople(OpinionCandidate candidate) {
        if (candidate.getEntities() != null) {
            for (EntityMention mention : candidate.getEntities()) {
                if (mention != null && EntityMention.TYPE_PERSON.equalsIgnoreCase(mention.getType())) {
                    return true;
                }
            }
        }
        for (String token : TextSupport.tokenize(candidate.getText())) {
            if (RELATIONSHIP_WORDS.contains(token)) {
                return true;
            }
        }
        return false;
    }

    private static int clamp(int trait) {
        return Math.max(DispositionTraits.MIN, Math.min(DispositionTraits.MAX, trait));
    }

    private static double clampUnit(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
