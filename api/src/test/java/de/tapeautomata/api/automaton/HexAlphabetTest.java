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

import java.util.Arrays;

import org.testng.Assert;
import org.testng.annotations.Test;

import net.automatalib.words.Word;

public class HexAlphabetTest {
    @Test
    public void testAlphabet() {
        Assert.assertEquals(HexAlphabet.getAlphabet().size(), 16);
        Assert.assertEquals(HexAlphabet.getAlphabet().getSymbol(0), Integer.valueOf(0));
        Assert.assertEquals(HexAlphabet.getAlphabet().getSymbol(15), Integer.valueOf(15));
        Assert.assertTrue(HexAlphabet.isSymbol(10));
        Assert.assertFalse(HexAlphabet.isSymbol(16));
        Assert.assertFalse(HexAlphabet.isSymbol(-1));
    }

    @Test
    public void testToWord() {
        Assert.assertEquals(HexAlphabet.toWord(""), Word.epsilon());
        Assert.assertEquals(HexAlphabet.toWord("a3"), Word.fromList(Arrays.asList(10, 3)));
        Assert.assertEquals(HexAlphabet.toWord("fF0"), Word.fromList(Arrays.asList(15, 15, 0)));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testInvalidDigit() {
        HexAlphabet.toWord("1g");
    }

    @Test
    public void testToString() {
        Assert.assertEquals(HexAlphabet.toString(Word.fromList(Arrays.asList(10, 3, 0))), "a30");
        Assert.assertEquals(HexAlphabet.toString(HexAlphabet.toWord("C0FFEE")), "c0ffee");
    }
}
