package me.golemcore.editor.domain.service;

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

import me.golemcore.editor.domain.model.Message;

import java.util.ArrayList;
import java.util.List;

/**
 * Bounds the transcript sent to the oracle: once it grows past
 * {@code maxMessages}, only the system messages and the
 * {@code keepRecent} most recent turns are kept.
 */
public class TranscriptTrimmer {

    private final int maxMessages;
    private final int keepRecent;

    public TranscriptTrimmer(int maxMessages, int keepRecent) {
        this.maxMessages = maxMessages;
        this.keepRecent = keepRecent;
    }

    public List<Message> trim(List<Message> transcript) {
        if (transcript.size() <= maxMessages) {
            return new ArrayList<>(transcript);
        }
        List<Message> system = new ArrayList<>();
        List<Message> turns = new ArrayList<>();
        for (Message message : transcript) {
            if (message.isSystemMessage()) {
                system.add(message);
            } else {
                turns.add(message);
            }
        }
        List<Message> trimmed = new ArrayList<>(system);
        trimmed.addAll(turns.subList(Math.max(0, turns.size() - keepRecent), turns.size()));
        return trimmed;
    }
}
