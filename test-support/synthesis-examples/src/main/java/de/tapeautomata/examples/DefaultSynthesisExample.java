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
package de.tapeautomata.examples;

import de.tapeautomata.api.automaton.HexAlphabet;
import de.tapeautomata.api.program.Program;
import net.automatalib.automata.fsa.DFA;
import net.automatalib.automata.fsa.impl.compact.CompactDFA;
import net.automatalib.words.Alphabet;

/**
 * Default implementation of a {@link SynthesisExample}.
 *
 * @author Gaëtan Staquet
 */
public class DefaultSynthesisExample implements SynthesisExample {

    private final Program program;
    private final int tapeLength;
    private final DFA<?, Integer> referenceAutomaton;

    public DefaultSynthesisExample(String programText, int tapeLength, DFA<?, Integer> referenceAutomaton) {
        this(Program.parse(programText), tapeLength, referenceAutomaton);
    }

    public DefaultSynthesisExample(Program program, int tapeLength, DFA<?, Integer> referenceAutomaton) {
        this.program = program;
        this.tapeLength = tapeLength;
        this.referenceAutomaton = referenceAutomaton;
    }

    @Override
    public Program getProgram() {
        return program;
    }

    @Override
    public int getTapeLength() {
        return tapeLength;
    }

    @Override
    public Alphabet<Integer> getAlphabet() {
        return HexAlphabet.getAlphabet();
    }

    @Override
    public DFA<?, Integer> getReferenceAutomaton() {
        return referenceAutomaton;
    }

    /**
     * @return An empty DFA over the hexadecimal alphabet
     */
    protected static CompactDFA<Integer> createReference() {
        return new CompactDFA<>(HexAlphabet.getAlphabet());
    }

    /**
     * @param accepting Whether every word is accepted
     * @return A DFA with a single state, accepting every word or no word
     */
    protected static CompactDFA<Integer> constantReference(boolean accepting) {
        CompactDFA<Integer> dfa = createReference();
        Integer q0 = dfa.addInitialState(accepting);
        for (Integer symbol : dfa.getInputAlphabet()) {
            dfa.setTransition(q0, symbol, q0);
        }
        return dfa;
    }

    @Override
    public String toString() {
        return program + " on " + tapeLength + " cells";
    }
}
