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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import de.tapeautomata.api.program.Program;

/**
 * Programs with a noticeably larger state space than the other examples, used
 * to measure the synthesis.
 *
 * @author Gaëtan Staquet
 */
public final class BenchmarkPrograms {

    public static final class Entry {
        private final String text;
        private final int tapeLength;

        Entry(String text, int tapeLength) {
            this.text = text;
            this.tapeLength = tapeLength;
        }

        public String getText() {
            return text;
        }

        public Program getProgram() {
            return Program.parse(text);
        }

        public int getTapeLength() {
            return tapeLength;
        }

        @Override
        public String toString() {
            return text + " on " + tapeLength + " cells";
        }
    }

    // @formatter:off
    private static final List<Entry> PROGRAMS = Collections.unmodifiableList(Arrays.asList(
            new Entry("+[>,,.<]", 2),
            new Entry(",>,[-<->]<[>.,<]", 2),
            new Entry("+[>,]+[[.,]+]", 3),
            new Entry(">+[>.,[>]<<]", 3),
            new Entry("+[>.,[<->[-]]<[,]+]", 2),
            new Entry(",>>+[.[,<<[->+>-<<]>[-<+>]>]+]", 3),
            new Entry(",[-[-]]]", 1)));
    // @formatter:on

    private BenchmarkPrograms() {
    }

    public static List<Entry> getPrograms() {
        return PROGRAMS;
    }
}
