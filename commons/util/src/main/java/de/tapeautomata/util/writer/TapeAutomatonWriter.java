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
package de.tapeautomata.util.writer;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.Writer;

import de.tapeautomata.api.automaton.TapeAutomaton;
import net.automatalib.commons.util.IOUtil;

/**
 * Writes the transition table of a tape automaton.
 * 
 * @author Gaëtan Staquet
 */
public interface TapeAutomatonWriter {
    void write(TapeAutomaton automaton, Appendable out) throws IOException;

    default void write(TapeAutomaton automaton, PrintStream out) {
        try {
            write(automaton, (Appendable) out);
        } catch (IOException ex) {
            throw new AssertionError("Writing to PrintStream must not throw", ex);
        }
    }

    default void write(TapeAutomaton automaton, StringBuilder out) {
        try {
            write(automaton, (Appendable) out);
        } catch (IOException ex) {
            throw new AssertionError("Writing to StringBuilder must not throw", ex);
        }
    }

    default void write(TapeAutomaton automaton, File file) throws IOException {
        try (Writer w = IOUtil.asBufferedUTF8Writer(file)) {
            write(automaton, w);
        }
    }
}
