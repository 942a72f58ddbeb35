/* Copyright (C) 2021 – University of Mons, University Antwerpen
 * This file is part of LearnLib, http://www.learnlib.de/..
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
 */
package de.tapeautomata.algorithms.synthesis;

import java.util.Objects;

import org.checkerframework.checker.nullness.qual.Nullable;

import de.tapeautomata.datastructure.configuration.Configuration;

/**
 * The effect of executing a single instruction.
 *
 * @author Gaëtan Staquet
 */
public final class StepOutcome {
    public static enum Kind {
        /**
         * An arithmetic, movement or loop instruction was executed.
         */
        ADVANCED,
        /**
         * An accept check was executed: the pending-acceptance flag is set.
         */
        MARKED_AND_ADVANCED,
        /**
         * The next instruction is a read. Nothing was executed.
         */
        READ_ATTEMPT,
        /**
         * The instruction pointer is past the last instruction, or an unmatched loop
         * instruction had to jump.
         */
        UNCONDITIONAL_HALT
    }

    private static final StepOutcome HALT = new StepOutcome(Kind.UNCONDITIONAL_HALT, null);

    private final Kind kind;
    private final @Nullable Configuration configuration;

    private StepOutcome(Kind kind, @Nullable Configuration configuration) {
        this.kind = kind;
        this.configuration = configuration;
    }

    static StepOutcome advanced(Configuration configuration) {
        return new StepOutcome(Kind.ADVANCED, configuration);
    }

    static StepOutcome markedAndAdvanced(Configuration configuration) {
        return new StepOutcome(Kind.MARKED_AND_ADVANCED, configuration);
    }

    static StepOutcome readAttempt(Configuration configuration) {
        return new StepOutcome(Kind.READ_ATTEMPT, configuration);
    }

    static StepOutcome halt() {
        return HALT;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isHalt() {
        return kind == Kind.UNCONDITIONAL_HALT;
    }

    /**
     * @return The configuration after the step, or, for a read attempt, the
     *         configuration just before the read
     * @throws IllegalStateException if the machine halted
     */
    public Configuration getConfiguration() {
        if (configuration == null) {
            throw new IllegalStateException("A halted machine has no next configuration");
        }
        return configuration;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj == null || obj.getClass() != this.getClass()) {
            return false;
        }
        StepOutcome o = (StepOutcome) obj;
        return o.kind == this.kind && Objects.equals(o.configuration, this.configuration);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, configuration);
    }

    @Override
    public String toString() {
        return configuration == null ? kind.toString() : kind + " " + configuration;
    }
}
