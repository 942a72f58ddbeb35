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

import java.util.Arrays;

import de.tapeautomata.api.automaton.HexAlphabet;
import de.tapeautomata.api.program.Program;

/**
 * An immutable tape of fixed length whose cells hold values between 0 and 15.
 *
 * Cells are indexed modulo the length of the tape. Two cells are packed in each
 * byte: the cell {@code 2k} in the low nibble, the cell {@code 2k + 1} in the
 * high nibble.
 *
 * @author Gaëtan Staquet
 */
public final class Tape {
    private final int length;
    private final byte[] cells;
    private final int hashCode;

    private Tape(int length, byte[] cells) {
        this.length = length;
        this.cells = cells;
        this.hashCode = 31 * length + Arrays.hashCode(cells);
    }

    /**
     * Creates a tape where every cell is zero.
     *
     * @param length The number of cells
     * @return The tape
     * @throws de.tapeautomata.api.exception.InvalidTapeLengthException if the
     *         length is smaller than one
     */
    public static Tape blank(int length) {
        Program.validateTapeLength(length);
        return new Tape(length, new byte[(length + 1) / 2]);
    }

    public int length() {
        return length;
    }

    /**
     * @param index The index of the cell, taken modulo the length
     * @return The value of the cell
     */
    public int get(int index) {
        int cell = Math.floorMod(index, length);
        return (cells[cell / 2] >> shift(cell)) & 0x0F;
    }

    /**
     * @param index The index of the cell, taken modulo the length
     * @param value The new value, between 0 and 15
     * @return A tape identical to this one except for that cell
     */
    public Tape with(int index, int value) {
        HexAlphabet.checkSymbol(value);
        int cell = Math.floorMod(index, length);
        byte[] newCells = cells.clone();
        newCells[cell / 2] = (byte) ((newCells[cell / 2] & ~(0x0F << shift(cell))) | (value << shift(cell)));
        return new Tape(length, newCells);
    }

    public Tape increment(int index) {
        return with(index, (get(index) + 1) & 0x0F);
    }

    public Tape decrement(int index) {
        return with(index, (get(index) - 1) & 0x0F);
    }

    private static int shift(int cell) {
        return 4 * (cell & 1);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj == null || obj.getClass() != this.getClass()) {
            return false;
        }
        Tape o = (Tape) obj;
        return o.length == this.length && Arrays.equals(o.cells, this.cells);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    /**
     * @return The cells as hexadecimal digits, for instance {@code [0A3]}
     */
    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(length + 2);
        builder.append('[');
        for (int i = 0; i < length; i++) {
            builder.append(Character.toUpperCase(Character.forDigit(get(i), HexAlphabet.SIZE)));
        }
        builder.append(']');
        return builder.toString();
    }
}
