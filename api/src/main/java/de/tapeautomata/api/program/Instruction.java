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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The instructions a tape machine program is made of.
 *
 * Each instruction is written as a single character in the program text. Every
 * other character is treated as a comment.
 *
 * @author Gaëtan Staquet
 */
public enum Instruction {
    /**
     * Increments the cell under the head, modulo 16.
     */
    INCREMENT('+'),
    /**
     * Decrements the cell under the head, modulo 16.
     */
    DECREMENT('-'),
    /**
     * Moves the head one cell to the right, wrapping around the tape.
     */
    MOVE_RIGHT('>'),
    /**
     * Moves the head one cell to the left, wrapping around the tape.
     */
    MOVE_LEFT('<'),
    /**
     * Jumps past the matching {@link #LOOP_CLOSE} if the cell under the head is
     * zero.
     */
    LOOP_OPEN('['),
    /**
     * Jumps back to the matching {@link #LOOP_OPEN} if the cell under the head is
     * not zero.
     */
    LOOP_CLOSE(']'),
    /**
     * Consumes the next input symbol and stores it in the cell under the head.
     */
    READ(','),
    /**
     * Marks the run as accepting, should the machine halt or the input end before
     * the next successful read.
     */
    ACCEPT_CHECK('.');

    private final char symbol;

    Instruction(char symbol) {
        this.symbol = symbol;
    }

    public char getSymbol() {
        return symbol;
    }

    public boolean isLoop() {
        return this == LOOP_OPEN || this == LOOP_CLOSE;
    }

    /**
     * Gives the instruction written with the given character.
     *
     * @param symbol The character
     * @return The instruction, or null if the character is a comment
     */
    public static @Nullable Instruction fromSymbol(char symbol) {
        switch (symbol) {
        case '+':
            return INCREMENT;
        case '-':
            return DECREMENT;
        case '>':
            return MOVE_RIGHT;
        case '<':
            return MOVE_LEFT;
        case '[':
            return LOOP_OPEN;
        case ']':
            return LOOP_CLOSE;
        case ',':
            return READ;
        case '.':
            return ACCEPT_CHECK;
        default:
            return null;
        }
    }
}
