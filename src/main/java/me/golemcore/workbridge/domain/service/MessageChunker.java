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
package me.golemcore.workbridge.domain.service;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits long text into chunks that fit the channel's message size limit.
 *
 * <p>
 * A chunk ends at the last newline past 70% of the limit, else at the last
 * space past 70%, else exactly at the limit. A surrogate pair is never split.
 * The separator at a cut is dropped together with any blank lines after it;
 * indentation of the next line is kept. Every chunk after the first starts
 * with {@code [Part i/N]} followed by a blank line.
 */
@Component
public class MessageChunker {

    private static final int PREFIX_RESERVE = 20;
    private static final double SOFT_BREAK_RATIO = 0.7;

    public List<String> split(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return List.of(text != null ? text : "");
        }

        int limit = maxLength > PREFIX_RESERVE * 2 ? maxLength - PREFIX_RESERVE : maxLength;
        List<String> parts = new ArrayList<>();
        String remaining = text;
        while (remaining.length() > limit) {
            int cut = findCut(remaining, limit);
            String part = remaining.substring(0, cut).stripTrailing();
            if (!part.isBlank()) {
                parts.add(part);
            }
            int next = isSeparator(remaining.charAt(cut)) ? cut + 1 : cut;
            while (next < remaining.length() && remaining.charAt(next) == '\n') {
                next++;
            }
            remaining = remaining.substring(next);
        }
        if (!remaining.isBlank()) {
            parts.add(remaining.stripTrailing());
        }

        int total = parts.size();
        if (total <= 1) {
            return parts;
        }
        List<String> chunks = new ArrayList<>(total);
        chunks.add(parts.get(0));
        for (int i = 1; i < total; i++) {
            chunks.add("[Part " + (i + 1) + "/" + total + "]\n\n" + parts.get(i));
        }
        return chunks;
    }

    private int findCut(String text, int limit) {
        int threshold = (int) (limit * SOFT_BREAK_RATIO);

        int newline = text.lastIndexOf('\n', limit);
        if (newline > threshold) {
            return newline;
        }
        int space = text.lastIndexOf(' ', limit);
        if (space > threshold) {
            return space;
        }

        int cut = limit;
        if (Character.isHighSurrogate(text.charAt(cut - 1))) {
            cut--;
        }
        return cut > 0 ? cut : Math.min(2, text.length());
    }

    private boolean isSeparator(char c) {
        return c == '\n' || c == ' ';
    }
}
