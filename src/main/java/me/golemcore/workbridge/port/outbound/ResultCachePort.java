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
package me.golemcore.workbridge.port.outbound;

import me.golemcore.workbridge.domain.model.CommandResult;

import java.util.Optional;

/**
 * Short-lived cache for workspace command results. Entries are volatile;
 * implementations may lose them at any time.
 */
public interface ResultCachePort {

    Optional<CommandResult> get(String key);

    void put(String key, CommandResult result, long ttlMs);

    /**
     * Drop every entry whose key starts with the given prefix.
     */
    void evictByPrefix(String keyPrefix);
}
