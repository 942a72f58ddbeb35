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
package de.tapeautomata.datastructure.configuration;

import java.util.Objects;

/**
 * The complete state of a tape machine at one point of its execution.
 *
 * A configuration stores four elements:
 * <ul>
 * <li>The contents of the tape.</li>
 * <li>The position of the head on the tape.</li>
 * <li>The instruction pointer, that is, the position of the next instruction
 * to execute in the program.</li>
 * <li>The pending-acceptance flag: whether an accept check was executed since
 * the last successful read (or since the start of the run).</li>
 * </ul>
 *
 * Configurations are values: two configurations are equal iff their four
 * elements are equal, and every operation returns a new configuration.
 *
 * @author Gaëtan Staquet
 */
public final class Configuration {
    private final Tape tape;
    private final int head;
    private final int instructionPointer;
    private final boolean pendingAcceptance;

    public Configuration(Tape tape, int head, int instructionPointer, boolean pendingAcceptance) {
        if (head < 0 || head >= tape.length()) {
            throw new IllegalArgumentException("The head " + head + " is outside of the tape " + tape);
        }
        if (instructionPointer < 0) {
            throw new IllegalArgumentException("Negative instruction pointer: " + instructionPointer);
        }
        this.tape = tape;
        this.head = head;
        this.instructionPointer = instructionPointer;
        this.pendingAcceptance = pendingAcceptance;
    }

    /**
     * The configuration of a machine that did not execute anything yet: every cell
     * is zero, and the head and instruction pointer are at position zero.
     *
     * @param tapeLength The number of cells
     * @return The initial configuration
     */
    public static Configuration initial(int tapeLength) {
        return new Configuration(Tape.blank(tapeLength), 0, 0, false);
    }

    public Tape getTape() {
        return tape;
    }

    public int getHead() {
        return head;
    }

    public int getInstructionPointer() {
        return instructionPointer;
    }

    public boolean isPendingAcceptance() {
        return pendingAcceptance;
    }

    /**
     * @return The value of the cell under the head
     */
    public int getCurrentCell() {
        return tape.get(head);
    }

    public Configuration withCurrentCell(int value) {
        return new Configuration(tape.with(head, value), head, instructionPointer, pendingAcceptance);
    }

    public Configuration incrementCurrentCell() {
        return new Configuration(tape.increment(head), head, instructionPointer, pendingAcceptance);
    }

    public Configuration decrementCurrentCell() {
        return new Configuration(tape.decrement(head), head, instructionPointer, pendingAcceptance);
    }

    /**
     * @param offset The number of cells to move by, negative to move left
     * @return The configuration with the head moved, wrapping around the tape
     */
    public Configuration moveHead(int offset) {
        return new Configuration(tape, Math.floorMod(head + offset, tape.length()), instructionPointer,
                pendingAcceptance);
    }

    public Configuration jumpTo(int instructionPointer) {
        return new Configuration(tape, head, instructionPointer, pendingAcceptance);
    }

    public Configuration advance() {
        return jumpTo(instructionPointer + 1);
    }

    public Configuration withPendingAcceptance(boolean pendingAcceptance) {
        if (pendingAcceptance == this.pendingAcceptance) {
            return this;
        }
        return new Configuration(tape, head, instructionPointer, pendingAcceptance);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj == null || obj.getClass() != this.getClass()) {
            return false;
        }
        Configuration o = (Configuration) obj;
        return o.head == this.head && o.instructionPointer == this.instructionPointer
                && o.pendingAcceptance == this.pendingAcceptance && o.tape.equals(this.tape);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tape, head, instructionPointer, pendingAcceptance);
    }

    @Override
    public String toString() {
        return "(" + tape + ", head=" + head + ", ip=" + instructionPointer + ", pending=" + pendingAcceptance + ")";
    }
}
