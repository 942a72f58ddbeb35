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
package de.tapeautomata.util;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;

import org.checkerframework.checker.nullness.qual.Nullable;

import de.tapeautomata.api.automaton.TapeAutomaton;
import net.automatalib.automata.fsa.DFA;
import net.automatalib.automata.fsa.impl.compact.CompactDFA;
import net.automatalib.serialization.dot.GraphDOT;
import net.automatalib.util.automata.Automata;
import net.automatalib.words.Alphabet;
import net.automatalib.words.Word;

/**
 * Utility methods for {@link TapeAutomaton}s.
 * 
 * @author Gaëtan Staquet
 */
public final class TapeAutomata {

    private TapeAutomata() {
    }

    /**
     * Converts a tape automaton into a complete DFA.
     * 
     * The state {@code q} of the automaton is the state {@code q} of the DFA. A
     * sealed state becomes a state with a self-loop on every symbol, accepting iff
     * its verdict is positive.
     * 
     * @param automaton The automaton
     * @return The DFA
     */
    public static CompactDFA<Integer> toDFA(TapeAutomaton automaton) {
        final Alphabet<Integer> alphabet = automaton.getInputAlphabet();
        final CompactDFA<Integer> dfa = new CompactDFA<>(alphabet, automaton.size());
        final List<Integer> dfaStates = new ArrayList<>(automaton.size());

        for (int state = 0; state < automaton.size(); state++) {
            boolean accepting = automaton.isAccepting(state);
            if (state == automaton.getInitialState()) {
                dfaStates.add(dfa.addInitialState(accepting));
            } else {
                dfaStates.add(dfa.addState(accepting));
            }
        }

        for (int state = 0; state < automaton.size(); state++) {
            Integer source = dfaStates.get(state);
            for (Integer symbol : alphabet) {
                Integer target;
                if (automaton.isSealed(state)) {
                    target = source;
                } else {
                    target = dfaStates.get(automaton.getSuccessor(state, symbol));
                }
                dfa.setTransition(source, symbol, target);
            }
        }

        return dfa;
    }

    /**
     * @param automaton The automaton
     * @param reference A complete DFA over the hexadecimal alphabet
     * @return A word on which the automaton and the DFA disagree, or null if they
     *         accept the same language
     */
    public static @Nullable Word<Integer> findSeparatingWord(TapeAutomaton automaton, DFA<?, Integer> reference) {
        return Automata.findSeparatingWord(toDFA(automaton), reference, automaton.getInputAlphabet());
    }

    public static boolean testEquivalence(TapeAutomaton automaton, DFA<?, Integer> reference) {
        return Automata.testEquivalence(toDFA(automaton), reference, automaton.getInputAlphabet());
    }

    /**
     * Decides whether two automata are equal up to a renaming of the states.
     * 
     * Both automata are explored in parallel from their initial states. Every
     * state is reachable from the initial state, so the exploration covers both
     * automata.
     * 
     * @param first  The first automaton
     * @param second The second automaton
     * @return True iff the automata are isomorphic
     */
    public static boolean isIsomorphic(TapeAutomaton first, TapeAutomaton second) {
        if (first.size() != second.size()) {
            return false;
        }

        final int[] mapping = new int[first.size()];
        final boolean[] mapped = new boolean[first.size()];
        final boolean[] used = new boolean[second.size()];
        final Queue<Integer> queue = new ArrayDeque<>();

        mapping[first.getInitialState()] = second.getInitialState();
        mapped[first.getInitialState()] = true;
        used[second.getInitialState()] = true;
        queue.add(first.getInitialState());

        while (!queue.isEmpty()) {
            int state = queue.poll();
            int image = mapping[state];

            if (first.isSealed(state) != second.isSealed(image)
                    || first.isAccepting(state) != second.isAccepting(image)) {
                return false;
            }
            if (first.isSealed(state)) {
                continue;
            }

            for (Integer symbol : first.getInputAlphabet()) {
                int successor = first.getSuccessor(state, symbol);
                int successorImage = second.getSuccessor(image, symbol);
                if (mapped[successor]) {
                    if (mapping[successor] != successorImage) {
                        return false;
                    }
                } else {
                    if (used[successorImage]) {
                        return false;
                    }
                    mapping[successor] = successorImage;
                    mapped[successor] = true;
                    used[successorImage] = true;
                    queue.add(successor);
                }
            }
        }

        return true;
    }

    /**
     * Writes the automaton in the GraphViz DOT format.
     * 
     * @param automaton The automaton
     * @param out       Where to write
     * @throws IOException If an error occurs while writing
     */
    public static void writeDOT(TapeAutomaton automaton, Appendable out) throws IOException {
        GraphDOT.write(toDFA(automaton), automaton.getInputAlphabet(), out);
    }
}
