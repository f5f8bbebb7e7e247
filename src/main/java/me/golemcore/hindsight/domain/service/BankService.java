package me.golemcore.hindsight.domain.service;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.hindsight.domain.exception.MemoryEngineException;
import me.golemcore.hindsight.domain.exception.NotFoundException;
import me.golemcore.hindsight.domain.exception.ValidationException;
import me.golemcore.hindsight.domain.model.Bank;
import me.golemcore.hindsight.domain.model.BackgroundMergeResult;
import me.golemcore.hindsight.domain.model.Capability;
import me.golemcore.hindsight.domain.model.DispositionTraits;
import me.golemcore.hindsight.domain.model.LlmRequest;
import me.golemcore.hindsight.domain.model.LlmResponse;
import me.golemcore.hindsight.domain.model.PersonalityTraits;
import me.golemcore.hindsight.port.outbound.LlmPort;
import me.golemcore.hindsight.port.outbound.MemoryRepositoryPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Bank profiles: auto-provisioning, personality and disposition traits, and
 * the free-text background.
 *
 * <p>
 * Banks are created with neutral traits on first reference and are never
 * deleted implicitly.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BankService {

    private static final String MERGE_SYSTEM_PROMPT = """
            You maintain the background of an AI agent, written in the first person ("I ...").
            Merge the NEW statements into the CURRENT background. When they conflict, the NEW
            statement wins and the old one is dropped. Keep every non-conflicting detail, remove
            repetition, and rewrite second-person statements ("You are ...") in the first person.
            Reply with the merged background only.""";

    private static final String MERGE_WITH_PERSONALITY_SYSTEM_PROMPT = """
            You maintain the background of an AI agent, written in the first person ("I ...").
            Merge the NEW statements into the CURRENT background. When they conflict, the NEW
            statement wins and the old one is dropped. Keep every non-conflicting detail, remove
            repetition, and rewrite second-person statements ("You are ...") in the first person.
            Then infer Big Five personality traits and bias strength from the merged background,
            each a number between 0 and 1 (0.5 is neutral).
            Reply with JSON only:
            {"background": "...", "personality": {"openness": 0.5, "conscientiousness": 0.5,
            "extraversion": 0.5, "agreeableness": 0.5, "neuroticism": 0.5, "bias_strength": 0.5}}""";

    private final MemoryRepositoryPort repository;
    private final BankWriteCoordinator writeCoordinator;
    private final LlmPort llmPort;
    private final CapabilityInvoker capabilityInvoker;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Returns the bank, creating it with neutral traits when it does not exist.
     */
    public Bank getProfile(String bankId) {
        String id = requireBankId(bankId);
        return repository.findBank(id).orElseGet(() -> provision(id));
    }

    /**
     * Returns the bank without creating it.
     *
     * @throws NotFoundException
     *             if the bank has never been referenced
     */
    public Bank requireExisting(String bankId) {
        String id = requireBankId(bankId);
        return repository.findBank(id)
                .orElseThrow(() -> new NotFoundException("Bank not found: " + id));
    }

    public List<Bank> listBanks() {
        return repository.listBanks();
    }

    public Bank updatePersonality(String bankId, PersonalityTraits personality) {
        validatePersonality(personality);
        String id = requireBankId(bankId);
        return writeCoordinator.exclusive(id, "update personality", () -> {
            Bank bank = getProfile(id);
            bank.setPersonality(personality.toBuilder().build());
            bank.setUpdatedAt(clock.instant());
            repository.saveBank(bank);
            log.info("[Bank] Personality of {} updated", id);
            return bank;
        });
    }

    public Bank updateDisposition(String bankId, DispositionTraits disposition) {
        validateDisposition(disposition);
        String id = requireBankId(bankId);
        return writeCoordinator.exclusive(id, "update disposition", () -> {
            Bank bank = getProfile(id);
            bank.setDisposition(disposition.toBuilder().build());
            bank.setUpdatedAt(clock.instant());
            repository.saveBank(bank);
            log.info("[Bank] Disposition of {} updated: skepticism={}, literalism={}, empathy={}",
                    id, disposition.getSkepticism(), disposition.getLiteralism(), disposition.getEmpathy());
            return bank;
        });
    }

    /**
     * Merges new background statements into the bank's background. Newer
     * statements override conflicting older ones. Without a usable LLM the new
     * text is appended.
     *
     * @param updatePersonality
     *            also infer and store personality traits from the merged
     *            background
     */
    public BackgroundMergeResult mergeBackground(String bankId, String content, boolean updatePersonality) {
        if (content == null || content.isBlank()) {
            throw new ValidationException("Background content must not be blank");
        }
        String id = requireBankId(bankId);
        return writeCoordinator.exclusive(id, "merge background",
                () -> mergeBackgroundLocked(getProfile(id), content, updatePersonality));
    }

    private BackgroundMergeResult mergeBackgroundLocked(Bank bank, String content, boolean updatePersonality) {
        String current = bank.getBackground() != null ? bank.getBackground() : "";

        String merged;
        PersonalityTraits inferred = null;
        if (llmPort.isAvailable()) {
            try {
                LlmResponse response = capabilityInvoker.invoke(Capability.REASONING, "background merge",
                        () -> llmPort.chat(mergeRequest(current, content.trim(), updatePersonality)));
                if (updatePersonality) {
                    JsonNode root = objectMapper.readTree(TextSupport.stripCodeFence(response.getContent()));
                    merged = root.path("background").asText(appended(current, content));
                    inferred = parsePersonality(root.path("personality"), bank.getPersonality());
                } else {
                    merged = response.getContent() != null ? response.getContent().trim() : "";
                }
            } catch (MemoryEngineException | JsonProcessingException e) {
                log.warn("[Bank] Background merge for {} fell back to append: {}", bank.getBankId(), e.getMessage());
                merged = appended(current, content);
            }
        } else {
            merged = appended(current, content);
        }
        if (merged.isBlank()) {
            merged = appended(current, content);
        }

        bank.setBackground(merged);
        if (updatePersonality) {
            if (inferred == null) {
                inferred = bank.getPersonality();
            }
            bank.setPersonality(inferred);
        }
        bank.setUpdatedAt(clock.instant());
        repository.saveBank(bank);
        log.info("[Bank] Background of {} merged ({} chars, personality {})", bank.getBankId(), merged.length(),
                updatePersonality ? "inferred" : "unchanged");
        return BackgroundMergeResult.builder()
                .background(merged)
                .personality(updatePersonality ? inferred.toBuilder().build() : null)
                .build();
    }

    static String requireBankId(String bankId) {
        if (bankId == null || bankId.isBlank()) {
            throw new ValidationException("Bank id must not be blank");
        }
        return bankId.trim();
    }

    private synchronized Bank provision(String bankId) {
        return repository.findBank(bankId).orElseGet(() -> {
            Instant now = clock.instant();
            Bank bank = Bank.builder()
                    .bankId(bankId)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            repository.saveBank(bank);
            log.info("[Bank] Provisioned bank {} with neutral traits", bankId);
            return bank;
        });
    }

    private LlmRequest mergeRequest(String current, String addition, boolean withPersonality) {
        String user = "CURRENT background:\n" + (current.isBlank() ? "(empty)" : current)
                + "\n\nNEW statements:\n" + addition;
        return LlmRequest.builder()
                .systemPrompt(withPersonality ? MERGE_WITH_PERSONALITY_SYSTEM_PROMPT : MERGE_SYSTEM_PROMPT)
                .userMessage(user)
                .temperature(0.0)
                .jsonResponse(withPersonality)
                .build();
    }

    private static PersonalityTraits parsePersonality(JsonNode node, PersonalityTraits fallback) {
        if (node == null || !node.isObject()) {
            return fallback;
        }
        return PersonalityTraits.builder()
                .openness(trait(node, "openness", fallback.getOpenness()))
                .conscientiousness(trait(node, "conscientiousness", fallback.getConscientiousness()))
                .extraversion(trait(node, "extraversion", fallback.getExtraversion()))
                .agreeableness(trait(node, "agreeableness", fallback.getAgreeableness()))
                .neuroticism(trait(node, "neuroticism", fallback.getNeuroticism()))
                .biasStrength(trait(node, "bias_strength", fallback.getBiasStrength()))
                .build();
    }

    private static double trait(JsonNode node, String field, double fallback) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            return fallback;
        }
        return Math.max(0.0, Math.min(1.0, value.asDouble()));
    }

    private static String appended(String current, String addition) {
        return current.isBlank() ? addition.trim() : current.trim() + "\n" + addition.trim();
    }

    static void validatePersonality(PersonalityTraits p) {
        if (p == null) {
            throw new ValidationException("Personality traits are required");
        }
        checkUnit("openness", p.getOpenness());
        checkUnit("conscientiousness", p.getConscientiousness());
        checkUnit("extraversion", p.getExtraversion());
        checkUnit("agreeableness", p.getAgreeableness());
        checkUnit("neuroticism", p.getNeuroticism());
        checkUnit("bias_strength", p.getBiasStrength());
    }

    static void validateDisposition(DispositionTraits d) {
        if (d == null) {
            throw new ValidationException("Disposition traits are required");
        }
        checkScale("skepticism", d.getSkepticism());
        checkScale("literalism", d.getLiteralism());
        checkScale("empathy", d.getEmpathy());
    }

    private static void checkUnit(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new ValidationException(name + " must be within [0, 1], got " + value);
        }
    }

    private static void checkScale(String name, int value) {
        if (value < DispositionTraits.MIN || value > DispositionTraits.MAX) {
            throw new ValidationException(name + " must be within [" + DispositionTraits.MIN + ", "
                    + DispositionTraits.MAX + "], got " + value);
        }
    }
}
