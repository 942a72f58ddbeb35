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

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import de.tapeautomata.api.program.Instruction;
import de.tapeautomata.api.program.Program;

/**
 * Generates random programs. The language of such a program is not known in
 * advance, so the generated programs have no reference automaton.
 *
 * Loop instructions are not forced to be balanced.
 *
 * @author Gaëtan Staquet
 */
public class ExampleRandomProgram {

    private final Program program;
    private final int tapeLength;

    public ExampleRandomProgram(int length, int tapeLength) {
        this(new Random(), length, tapeLength);
    }

    public ExampleRandomProgram(Random rand, int length, int tapeLength) {
        this.program = constructProgram(rand, length);
        this.tapeLength = tapeLength;
    }

    public static Program constructProgram(Random rand, int length) {
        if (length < 1) {
            throw new IllegalArgumentException("A program needs at least one instruction");
        }
        Instruction[] instructions = Instruction.values();
        List<Instruction> program = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            program.add(instructions[rand.nextInt(instructions.length)]);
        }
        return Program.of(program);
    }

    public Program getProgram() {
        return program;
    }

    public int getTapeLength() {
        return tapeLength;
    }

    @Override
    public String toString() {
        return program + " on " + tapeLength + " cells";
    }
}
