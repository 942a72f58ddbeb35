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
package de.tapeautomata.api.automaton;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import net.automatalib.words.Alphabet;

/**
 * A read-only automaton over the hexadecimal alphabet, synthesized from a tape
 * machine program.
 *
 * States are identified by the integers {@code 0} to {@code size() - 1}. A state
 * is of one of two kinds:
 * <ul>
 * <li>A read-boundary state: the machine is about to read an input symbol. The
 * state is accepting if the input may end here, and it has exactly one
 * successor for each of the sixteen symbols.</li>
 * <li>A sealed state: the machine halted, or entered an infinite loop, before
 * reading again. Its verdict does not depend on the remaining input and it has
 * no successor.</li>
 * </ul>
 *
 * @author Gaëtan Staquet
 */
public interface TapeAutomaton {

    int getInitialState();

    /**
     * @return The number of states
     */
    int size();

    default List<Integer> getStates() {
        return IntStream.range(0, size()).boxed().collect(Collectors.toList());
    }

    default Alphabet<Integer> getInputAlphabet() {
        return HexAlphabet.getAlphabet();
    }

    boolean isSealed(int state);

    /**
     * For a read-boundary state, whether a word ending in this state is accepted.
     * For a sealed state, the verdict for every word reaching it.
     *
     * @param state The state
     * @return Whether the state accepts
     */
    boolean isAccepting(int state);

    /**
     * @param state  A read-boundary state
     * @param symbol The symbol, between 0 and 15
     * @return The state reached by reading the symbol
     * @throws IllegalStateException    if the state is sealed
     * @throws IllegalArgumentException if the symbol is not hexadecimal
     */
    int getSuccessor(int state, int symbol);

    /**
     * Decides whether the word is accepted, by walking the automaton.
     *
     * @param input The word
     * @return True iff the word is accepted
     */
    default boolean accepts(Iterable<Integer> input) {
        int state = getInitialState();
        for (Integer symbol : input) {
            if (isSealed(state)) {
                return isAccepting(state);
            }
            state = getSuccessor(state, symbol);
        }
        return isAccepting(state);
    }

    default boolean accepts(CharSequence hexDigits) {
        return accepts(HexAlphabet.toWord(hexDigits));
    }
}
