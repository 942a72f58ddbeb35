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

import de.tapeautomata.api.program.Program;
import net.automatalib.automata.fsa.DFA;
import net.automatalib.words.Alphabet;

/**
 * A program together with the language it is known to accept.
 *
 * @author Gaëtan Staquet
 */
public interface SynthesisExample {

    Program getProgram();

    int getTapeLength();

    Alphabet<Integer> getAlphabet();

    /**
     * @return A complete DFA accepting exactly the words the program accepts
     */
    DFA<?, Integer> getReferenceAutomaton();
}
