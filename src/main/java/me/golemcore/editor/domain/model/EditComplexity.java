package me.golemcore.editor.domain.model;

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

import java.util.Locale;

/**
 * Complexity class of an edit goal. Drives prompt tiering, the verifier's
 * change-ratio allowance and the estimated change count.
 */
public enum EditComplexity {

    TRIVIAL(1, 0.2), SIMPLE(2, 0.35), MODERATE(4, 0.5), COMPLEX(4, 0.8);

    private final int estimatedChanges;
    private final double changeRatioAllowance;

    EditComplexity(int estimatedChanges, double changeRatioAllowance) {
        this.estimatedChanges = estimatedChanges;
        this.changeRatioAllowance = changeRatioAllowance;
    }

    public int getEstimatedChanges() {
        return estimatedChanges;
    }

    public double getChangeRatioAllowance() {
        return changeRatioAllowance;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient lookup by wire name, returns {@code null} for unknown values.
     */
    public static EditComplexity fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (EditComplexity complexity : values()) {
            if (complexity.wireName().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return complexity;
            }
        }
        return null;
    }
}
