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

import org.testng.Assert;
import org.testng.annotations.Test;

import de.tapeautomata.api.exception.InvalidTapeLengthException;

public class TapeTest {
    @Test
    public void testBlank() {
        Tape tape = Tape.blank(3);

        Assert.assertEquals(tape.length(), 3);
        for (int i = 0; i < 3; i++) {
            Assert.assertEquals(tape.get(i), 0);
        }
        Assert.assertEquals(tape.toString(), "[000]");
    }

    @Test(expectedExceptions = InvalidTapeLengthException.class)
    public void testZeroLength() {
        Tape.blank(0);
    }

    @Test
    public void testNibblesAreIndependent() {
        Tape tape = Tape.blank(5).with(0, 10).with(1, 3).with(4, 15);

        Assert.assertEquals(tape.get(0), 10);
        Assert.assertEquals(tape.get(1), 3);
        Assert.assertEquals(tape.get(2), 0);
        Assert.assertEquals(tape.get(3), 0);
        Assert.assertEquals(tape.get(4), 15);
        Assert.assertEquals(tape.toString(), "[A300F]");

        Tape overwritten = tape.with(1, 12);
        Assert.assertEquals(overwritten.get(0), 10);
        Assert.assertEquals(overwritten.get(1), 12);
    }

    @Test
    public void testIndicesWrap() {
        Tape tape = Tape.blank(3).with(4, 7);

        Assert.assertEquals(tape.get(1), 7);
        Assert.assertEquals(tape.get(-2), 7);
        Assert.assertEquals(tape.get(7), 7);
    }

    @Test
    public void testArithmeticWraps() {
        Tape tape = Tape.blank(2);

        Assert.assertEquals(tape.decrement(0).get(0), 15);
        Assert.assertEquals(tape.with(1, 15).increment(1).get(1), 0);
        Assert.assertEquals(tape.increment(1).increment(1).get(1), 2);
    }

    @Test
    public void testImmutability() {
        Tape tape = Tape.blank(2);
        Tape modified = tape.with(0, 5);

        Assert.assertEquals(tape.get(0), 0);
        Assert.assertEquals(modified.get(0), 5);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testInvalidValue() {
        Tape.blank(2).with(0, 16);
    }

    @Test
    public void testEquality() {
        Tape a = Tape.blank(3).with(2, 9);
        Tape b = Tape.blank(3).increment(2).with(2, 9);

        Assert.assertEquals(a, b);
        Assert.assertEquals(a.hashCode(), b.hashCode());
        Assert.assertNotEquals(a, Tape.blank(3));
        // Same packed bytes, different lengths
        Assert.assertNotEquals(Tape.blank(3), Tape.blank(4));
    }
}
