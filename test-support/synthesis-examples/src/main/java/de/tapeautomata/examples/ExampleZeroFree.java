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
 * The program {@code >+[>.,[>]<<]} on three cells, accepting the words that do
 * not contain the symbol {@code 0}.
 *
 * Reading a zero makes the inner loop skip, which walks the head back on a
 * zero cell and exits the outer loop: the machine halts without a pending
 * accept check.
 *
 * @author Gaëtan Staquet
 */
public class ExampleZeroFree extends DefaultSynthesisExample {

    public static final String PROGRAM = ">+[>.,[>]<<]";
    public static final int TAPE_LENGTH = 3;

    public ExampleZeroFree() {
        super(PROGRAM, TAPE_LENGTH, constructReference());
    }

    /**
     * @return A DFA accepting the words without {@code 0}
     */
    public static CompactDFA<Integer> constructReference() {
        CompactDFA<Integer> dfa = createReference();

        Integer zeroFree = dfa.addInitialState(true);
        Integer sink = dfa.addState(false);

        for (Integer symbol : dfa.getInputAlphabet()) {
            dfa.setTransition(zeroFree, symbol, symbol == 0 ? sink : zeroFree);
            dfa.setTransition(sink, symbol, sink);
        }

        return dfa;
    }

    public static ExampleZeroFree createExample() {
        return new ExampleZeroFree();
    }
}
