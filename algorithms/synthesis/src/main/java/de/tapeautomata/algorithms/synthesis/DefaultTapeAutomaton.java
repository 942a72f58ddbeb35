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

import java.util.Arrays;

import de.tapeautomata.api.automaton.HexAlphabet;
import de.tapeautomata.api.automaton.TapeAutomaton;

/**
 * Immutable tape automaton stored in flat arrays.
 *
 * The successors of the state {@code q} are stored in
 * {@code successors[16 * q]} to {@code successors[16 * q + 15]}. A sealed state
 * has {@link #NO_SUCCESSOR} in all its slots.
 *
 * @author Gaëtan Staquet
 */
public final class DefaultTapeAutomaton implements TapeAutomaton {
    static final int NO_SUCCESSOR = -1;

    private final int initialState;
    private final boolean[] sealed;
    private final boolean[] accepting;
    private final int[] successors;

    DefaultTapeAutomaton(int initialState, boolean[] sealed, boolean[] accepting, int[] successors) {
        assert sealed.length == accepting.length;
        assert successors.length == sealed.length * HexAlphabet.SIZE;
        this.initialState = initialState;
        this.sealed = sealed;
        this.accepting = accepting;
        this.successors = successors;
    }

    @Override
    public int getInitialState() {
        return initialState;
    }

    @Override
    public int size() {
        return sealed.length;
    }

    @Override
    public boolean isSealed(int state) {
        return sealed[state];
    }

    @Override
    public boolean isAccepting(int state) {
        return accepting[state];
    }

    @Override
    public int getSuccessor(int state, int symbol) {
        HexAlphabet.checkSymbol(symbol);
        if (sealed[state]) {
            throw new IllegalStateException("The state " + state + " is sealed and has no successor");
        }
        return successors[state * HexAlphabet.SIZE + symbol];
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj == null || obj.getClass() != this.getClass()) {
            return false;
        }
        DefaultTapeAutomaton o = (DefaultTapeAutomaton) obj;
        return o.initialState == this.initialState && Arrays.equals(o.sealed, this.sealed)
                && Arrays.equals(o.accepting, this.accepting) && Arrays.equals(o.successors, this.successors);
    }

    @Override
    public int hashCode() {
        int result = initialState;
        result = 31 * result + Arrays.hashCode(sealed);
        result = 31 * result + Arrays.hashCode(accepting);
        result = 31 * result + Arrays.hashCode(successors);
        return result;
    }

    @Override
    public String toString() {
        int sealedStates = 0;
        for (boolean s : sealed) {
            if (s) {
                sealedStates++;
            }
        }
        return "TapeAutomaton(" + size() + " states, " + sealedStates + " sealed, initial " + initialState + ")";
    }
}
