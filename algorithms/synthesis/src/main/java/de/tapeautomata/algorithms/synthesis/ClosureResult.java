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

import org.checkerframework.checker.nullness.qual.Nullable;

import de.tapeautomata.datastructure.configuration.Configuration;

/**
 * How the deterministic execution between two reads ended.
 *
 * Either the machine reached its next read (a read boundary), or it reached a
 * sealed halt: it stopped, or entered an infinite loop, without reading again.
 * In both cases, {@link #isAccepting()} gives the value of the pending-acceptance
 * flag accumulated along the way.
 *
 * @author Gaëtan Staquet
 */
public final class ClosureResult {
    public static enum Kind {
        READ_BOUNDARY, SEALED_HALT
    }

    public static enum HaltCause {
        END_OF_PROGRAM, UNMATCHED_JUMP, NON_TERMINATION
    }

    private final Kind kind;
    private final @Nullable Configuration boundary;
    private final @Nullable HaltCause haltCause;
    private final boolean accepting;
    private final int steps;
    private final int visitedConfigurations;

    private ClosureResult(Kind kind, @Nullable Configuration boundary, @Nullable HaltCause haltCause,
            boolean accepting, int steps, int visitedConfigurations) {
        this.kind = kind;
        this.boundary = boundary;
        this.haltCause = haltCause;
        this.accepting = accepting;
        this.steps = steps;
        this.visitedConfigurations = visitedConfigurations;
    }

    static ClosureResult readBoundary(Configuration boundary, int steps, int visitedConfigurations) {
        return new ClosureResult(Kind.READ_BOUNDARY, boundary, null, boundary.isPendingAcceptance(), steps,
                visitedConfigurations);
    }

    static ClosureResult sealedHalt(HaltCause cause, boolean accepting, int steps, int visitedConfigurations) {
        return new ClosureResult(Kind.SEALED_HALT, null, cause, accepting, steps, visitedConfigurations);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isSealed() {
        return kind == Kind.SEALED_HALT;
    }

    /**
     * @return The configuration just before the read
     * @throws IllegalStateException if the result is a sealed halt
     */
    public Configuration getBoundary() {
        if (boundary == null) {
            throw new IllegalStateException("A sealed halt has no read boundary");
        }
        return boundary;
    }

    /**
     * @return Why the machine stopped
     * @throws IllegalStateException if the result is a read boundary
     */
    public HaltCause getHaltCause() {
        if (haltCause == null) {
            throw new IllegalStateException("A read boundary has no halt cause");
        }
        return haltCause;
    }

    public boolean isAccepting() {
        return accepting;
    }

    /**
     * @return The number of instructions executed
     */
    public int getSteps() {
        return steps;
    }

    /**
     * @return The largest number of configurations the cycle detection had to
     *         remember at once
     */
    public int getVisitedConfigurations() {
        return visitedConfigurations;
    }

    @Override
    public String toString() {
        if (kind == Kind.READ_BOUNDARY) {
            return kind + " " + boundary;
        }
        return kind + "(" + haltCause + ", accepting=" + accepting + ")";
    }
}
