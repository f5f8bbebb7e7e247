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

public class ConflictException extends MemoryEngineException {

    private static final long serialVersionUID = 1L;

    public ConflictException(String message) {
        super(ErrorKind.CONFLICT, message);
    }

    public ConflictException(String message, Throwable cause) {
        super(ErrorKind.CONFLICT, message, cause);
    }
}
