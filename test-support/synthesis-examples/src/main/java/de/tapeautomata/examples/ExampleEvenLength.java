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

import net.automatalib.automata.fsa.impl.compact.CompactDFA;

/**
 * The program {@code +[>.,,<]} on two cells, accepting the words of even
 * length.
 *
 * The first cell stays at one, so the loop never ends. The second cell
 * receives the input, and the accept check runs before every other read.
 *
 * @author Gaëtan Staquet
 */
public class ExampleEvenLength extends DefaultSynthesisExample {

    public static final String PROGRAM = "+[>.,,<]";
    public static final int TAPE_LENGTH = 2;

    public ExampleEvenLength() {
        super(PROGRAM, TAPE_LENGTH, constructReference());
    }

    /**
     * @return A DFA accepting the words of even length over the hexadecimal
     *         alphabet
     */
    public static CompactDFA<Integer> constructReference() {
        CompactDFA<Integer> dfa = createReference();

        Integer even = dfa.addInitialState(true);
        Integer odd = dfa.addState(false);

        for (Integer symbol : dfa.getInputAlphabet()) {
            dfa.setTransition(even, symbol, odd);
            dfa.setTransition(odd, symbol, even);
        }

        return dfa;
    }

    public static ExampleEvenLength createExample() {
        return new ExampleEvenLength();
    }
}
