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
package de.tapeautomata.api.program;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Stack;

import de.tapeautomata.api.exception.EmptyProgramException;
import de.tapeautomata.api.exception.InvalidTapeLengthException;

/**
 * An immutable tape machine program.
 *
 * On top of the sequence of instructions, a program stores where each loop
 * instruction jumps to:
 * <ul>
 * <li>a {@link Instruction#LOOP_OPEN} jumps to the position just after its
 * matching {@link Instruction#LOOP_CLOSE},</li>
 * <li>a {@link Instruction#LOOP_CLOSE} jumps back to its matching
 * {@link Instruction#LOOP_OPEN}.</li>
 * </ul>
 * A loop instruction without partner gets the jump target {@link #UNMATCHED}.
 * This is not an error: the machine simply halts when such an instruction has
 * to jump.
 *
 * @author Gaëtan Staquet
 */
public final class Program {
    public static final int UNMATCHED = -1;

    private final List<Instruction> instructions;
    private final int[] jumpTargets;

    private Program(List<Instruction> instructions) {
        this.instructions = Collections.unmodifiableList(new ArrayList<>(instructions));
        this.jumpTargets = resolveJumpTargets(this.instructions);
    }

    /**
     * Parses a program text. Characters that are not instructions are ignored.
     *
     * @param text The program text
     * @return The program
     * @throws EmptyProgramException if the text does not contain any instruction
     */
    public static Program parse(CharSequence text) {
        List<Instruction> instructions = new ArrayList<>(text.length());
        for (int i = 0; i < text.length(); i++) {
            Instruction instruction = Instruction.fromSymbol(text.charAt(i));
            if (instruction != null) {
                instructions.add(instruction);
            }
        }
        return of(instructions);
    }

    public static Program of(Instruction... instructions) {
        return of(Arrays.asList(instructions));
    }

    /**
     * @param instructions The instructions, in order
     * @return The program
     * @throws EmptyProgramException if the list is empty
     */
    public static Program of(List<Instruction> instructions) {
        if (instructions.isEmpty()) {
            throw new EmptyProgramException();
        }
        return new Program(instructions);
    }

    /**
     * Checks that a tape of the given length can be used to run a program.
     *
     * @param tapeLength The number of cells
     * @throws InvalidTapeLengthException if the length is smaller than one
     */
    public static void validateTapeLength(int tapeLength) {
        if (tapeLength < 1) {
            throw new InvalidTapeLengthException(tapeLength);
        }
    }

    private static int[] resolveJumpTargets(List<Instruction> instructions) {
        int[] targets = new int[instructions.size()];
        Arrays.fill(targets, UNMATCHED);

        Stack<Integer> openLoops = new Stack<>();
        for (int position = 0; position < instructions.size(); position++) {
            switch (instructions.get(position)) {
            case LOOP_OPEN:
                openLoops.push(position);
                break;
            case LOOP_CLOSE:
                if (!openLoops.isEmpty()) {
                    int open = openLoops.pop();
                    targets[open] = position + 1;
                    targets[position] = open;
                }
                break;
            default:
                break;
            }
        }
        // Whatever is left on the stack keeps UNMATCHED

        return targets;
    }

    public int size() {
        return instructions.size();
    }

    public Instruction getInstruction(int position) {
        return instructions.get(position);
    }

    public List<Instruction> getInstructions() {
        return instructions;
    }

    /**
     * Gives the position a loop instruction jumps to.
     *
     * @param position The position of a loop instruction
     * @return The jump target, or {@link #UNMATCHED}
     * @throws IllegalArgumentException if the instruction at that position is not
     *                                  a loop instruction
     */
    public int getJumpTarget(int position) {
        if (!getInstruction(position).isLoop()) {
            throw new IllegalArgumentException(
                    "The instruction at position " + position + " is not a loop instruction: " + getInstruction(position));
        }
        return jumpTargets[position];
    }

    public boolean isMatched(int position) {
        return getJumpTarget(position) != UNMATCHED;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj == null || obj.getClass() != this.getClass()) {
            return false;
        }
        Program o = (Program) obj;
        return instructions.equals(o.instructions);
    }

    @Override
    public int hashCode() {
        return instructions.hashCode();
    }

    /**
     * @return The program text, without any comment
     */
    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(instructions.size());
        for (Instruction instruction : instructions) {
            builder.append(instruction.getSymbol());
        }
        return builder.toString();
    }
}
