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

/**
 * Base of every error the memory engine reports on purpose.
 */
public class MemoryEngineException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    public MemoryEngineException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public MemoryEngineException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Maps any throwable to an {@link ErrorKind}, unwrapping completion
     * wrappers.
     */
    public static ErrorKind kindOf(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof MemoryEngineException engineException) {
                return engineException.getKind();
            }
            current = current.getCause();
        }
        return ErrorKind.INTERNAL;
    }
}
