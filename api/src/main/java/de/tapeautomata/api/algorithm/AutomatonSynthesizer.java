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
package de.tapeautomata.api.algorithm;

import de.tapeautomata.api.automaton.TapeAutomaton;
import de.tapeautomata.api.program.Program;

/**
 * Basic interface for an algorithm constructing the automaton recognizing the
 * language of a tape machine program.
 *
 * Each call is a full and independent synthesis.
 *
 * @param <A> Automaton type
 * @author Gaëtan Staquet
 */
public interface AutomatonSynthesizer<A extends TapeAutomaton> {
    /**
     * @param program    The program
     * @param tapeLength The number of cells of the tape
     * @return The automaton accepting exactly the words the program accepts
     * @throws de.tapeautomata.api.exception.InvalidTapeLengthException if the
     *         tape length is smaller than one
     */
    A synthesize(Program program, int tapeLength);
}
