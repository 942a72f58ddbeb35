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
 * The program {@code .,}: the run is accepting if the input is over before the
 * read. After a successful read, the machine halts with a cleared flag. Only
 * the empty word is accepted.
 *
 * @author Gaëtan Staquet
 */
public class ExampleEmptyWordOnly extends DefaultSynthesisExample {

    public static final String PROGRAM = ".,";

    public ExampleEmptyWordOnly() {
        super(PROGRAM, 1, constructReference());
    }

    public static CompactDFA<Integer> constructReference() {
        CompactDFA<Integer> dfa = createReference();

        Integer empty = dfa.addInitialState(true);
        Integer sink = dfa.addState(false);

        for (Integer symbol : dfa.getInputAlphabet()) {
            dfa.setTransition(empty, symbol, sink);
            dfa.setTransition(sink, symbol, sink);
        }

        return dfa;
    }

    public static ExampleEmptyWordOnly createExample() {
        return new ExampleEmptyWordOnly();
    }
}
