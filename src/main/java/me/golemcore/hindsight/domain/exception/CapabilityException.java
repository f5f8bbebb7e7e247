package me.golemcore.hindsight.domain.exception;

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

import me.golemcore.hindsight.domain.model.Capability;

/**
 * Capability call failed after its retry budget was spent.
 */
public class CapabilityException extends MemoryEngineException {

    private static final long serialVersionUID = 1L;

    private final Capability capability;
    private final int attempts;

    public CapabilityException(Capability capability, int attempts, String message, Throwable cause) {
        super(capability.getFailureKind(), message, cause);
        this.capability = capability;
        this.attempts = attempts;
    }

    public Capability getCapability() {
        return capability;
    }

    public int getAttempts() {
        return attempts;
    }
}
