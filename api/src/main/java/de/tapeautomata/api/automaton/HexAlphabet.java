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
package de.tapeautomata.api.automaton;

import net.automatalib.words.Alphabet;
import net.automatalib.words.Word;
import net.automatalib.words.WordBuilder;
import net.automatalib.words.impl.Alphabets;

/**
 * The sixteen input symbols of a tape automaton, that is, the values a tape
 * cell can hold.
 *
 * Words are written as strings of hexadecimal digits, one digit per symbol.
 *
 * @author Gaëtan Staquet
 */
public final class HexAlphabet {
    public static final int SIZE = 16;

    public static final int MAX_SYMBOL = SIZE - 1;

    private static final Alphabet<Integer> ALPHABET = Alphabets.integers(0, MAX_SYMBOL);

    private HexAlphabet() {
    }

    public static Alphabet<Integer> getAlphabet() {
        return ALPHABET;
    }

    public static boolean isSymbol(int symbol) {
        return 0 <= symbol && symbol <= MAX_SYMBOL;
    }

    public static void checkSymbol(int symbol) {
        if (!isSymbol(symbol)) {
            throw new IllegalArgumentException("Not an hexadecimal symbol: " + symbol);
        }
    }

    /**
     * Converts a string of hexadecimal digits (in any case) into a word.
     *
     * @param digits The digits
     * @return The word with one symbol per digit
     * @throws IllegalArgumentException if a character is not an hexadecimal digit
     */
    public static Word<Integer> toWord(CharSequence digits) {
        WordBuilder<Integer> builder = new WordBuilder<>(digits.length());
        for (int i = 0; i < digits.length(); i++) {
            int symbol = Character.digit(digits.charAt(i), SIZE);
            if (symbol == -1) {
                throw new IllegalArgumentException(
                        "Not an hexadecimal digit at index " + i + ": '" + digits.charAt(i) + "'");
            }
            builder.append(symbol);
        }
        return builder.toWord();
    }

    /**
     * @param word A word over the hexadecimal alphabet
     * @return The word written with lower case hexadecimal digits
     */
    public static String toString(Iterable<Integer> word) {
        StringBuilder builder = new StringBuilder();
        for (Integer symbol : word) {
            checkSymbol(symbol);
            builder.append(Character.forDigit(symbol, SIZE));
        }
        return builder.toString();
    }
}
