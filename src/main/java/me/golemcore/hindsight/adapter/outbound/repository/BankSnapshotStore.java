package me.golemcore.hindsight.adapter.outbound.repository;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.hindsight.infrastructure.config.HindsightProperties;
import me.golemcore.hindsight.port.outbound.StoragePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes bank snapshots as JSON through {@link StoragePort}. A no-op
 * unless {@code hindsight.storage.snapshots-enabled} is set.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BankSnapshotStore {

    private static final String SUFFIX = ".json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final HindsightProperties properties;

    public boolean isEnabled() {
        return properties.getStorage().isSnapshotsEnabled();
    }

    /**
     * Writes the snapshot atomically.
     *
     * @throws IllegalStateException
     *             if the snapshot cannot be persisted
     */
    public void save(BankSnapshot snapshot) {
        if (!isEnabled()) {
            return;
        }
        String bankId = snapshot.bank().getBankId();
        try {
            String json = objectMapper.writeValueAsString(snapshot);
            storagePort.putTextAtomic(directory(), fileName(bankId), json).join();
            log.debug("[Snapshot] Saved bank {} ({} units)", bankId, snapshot.units().size());
        } catch (IOException | RuntimeException e) { // NOSONAR - every failure aborts the commit
            throw new IllegalStateException("Failed to persist snapshot of bank " + bankId, e);
        }
    }

    /**
     * Loads every readable snapshot. Unreadable files are skipped with a
     * warning.
     */
    public List<BankSnapshot> loadAll() {
        if (!isEnabled()) {
            return List.of();
        }
        storagePort.ensureDirectory(directory()).join();
        List<BankSnapshot> snapshots = new ArrayList<>();
        for (String name : storagePort.listObjects(directory(), null).join()) {
            if (!name.endsWith(SUFFIX)) {
                continue;
            }
            try {
                String json = storagePort.getText(directory(), name).join();
                if (json == null || json.isBlank()) {
                    continue;
                }
                BankSnapshot snapshot = objectMapper.readValue(json, BankSnapshot.class);
                if (snapshot.bank() == null || !bankIdOf(name).equals(snapshot.bank().getBankId())) {
                    log.warn("[Snapshot] Skipping {}: bank id does not match file name", name);
                    continue;
                }
                snapshots.add(snapshot);
            } catch (IOException | RuntimeException e) { // NOSONAR - a corrupt file must not block startup
                log.warn("[Snapshot] Skipping unreadable snapshot {}: {}", name, e.getMessage());
            }
        }
        log.info("[Snapshot] Loaded {} bank snapshot(s)", snapshots.size());
        return snapshots;
    }

    private String directory() {
        return properties.getStorage().getDirectory();
    }

    static String fileName(String bankId) {
        return URLEncoder.encode(bankId, StandardCharsets.UTF_8) + SUFFIX;
    }

    static String bankIdOf(String fileName) {
        return URLDecoder.decode(fileName.substring(0, fileName.length() - SUFFIX.length()),
                StandardCharsets.UTF_8);
    }
}
