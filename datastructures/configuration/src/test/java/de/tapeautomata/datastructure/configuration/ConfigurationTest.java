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

import java.util.HashSet;
import java.util.Set;

import org.testng.Assert;
import org.testng.annotations.Test;

public class ConfigurationTest {
    @Test
    public void testInitial() {
        Configuration initial = Configuration.initial(2);

        Assert.assertEquals(initial.getTape(), Tape.blank(2));
        Assert.assertEquals(initial.getHead(), 0);
        Assert.assertEquals(initial.getInstructionPointer(), 0);
        Assert.assertFalse(initial.isPendingAcceptance());
        Assert.assertEquals(initial.getCurrentCell(), 0);
    }

    @Test
    public void testHeadMovementWraps() {
        Configuration configuration = Configuration.initial(3);

        Assert.assertEquals(configuration.moveHead(-1).getHead(), 2);
        Assert.assertEquals(configuration.moveHead(1).moveHead(1).moveHead(1).getHead(), 0);
    }

    @Test
    public void testCurrentCell() {
        Configuration configuration = Configuration.initial(2).moveHead(1).withCurrentCell(4).incrementCurrentCell();

        Assert.assertEquals(configuration.getCurrentCell(), 5);
        Assert.assertEquals(configuration.getTape().get(0), 0);
        Assert.assertEquals(configuration.moveHead(1).decrementCurrentCell().getCurrentCell(), 15);
    }

    @Test
    public void testInstructionPointer() {
        Configuration configuration = Configuration.initial(1).advance().advance();

        Assert.assertEquals(configuration.getInstructionPointer(), 2);
        Assert.assertEquals(configuration.jumpTo(7).getInstructionPointer(), 7);
    }

    @Test
    public void testEqualityCoversEveryField() {
        Configuration base = Configuration.initial(2);
        Set<Configuration> configurations = new HashSet<>();

        configurations.add(base);
        configurations.add(base.withCurrentCell(1));
        configurations.add(base.moveHead(1));
        configurations.add(base.advance());
        configurations.add(base.withPendingAcceptance(true));

        Assert.assertEquals(configurations.size(), 5);

        Configuration same = new Configuration(Tape.blank(2), 0, 0, false);
        Assert.assertEquals(same, base);
        Assert.assertTrue(configurations.contains(same));
        Assert.assertTrue(configurations.contains(same.withPendingAcceptance(true)));
    }

    @Test
    public void testPendingAcceptanceIsIdempotent() {
        Configuration marked = Configuration.initial(1).withPendingAcceptance(true);

        Assert.assertSame(marked.withPendingAcceptance(true), marked);
        Assert.assertFalse(marked.withPendingAcceptance(false).isPendingAcceptance());
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testHeadOutsideTape() {
        new Configuration(Tape.blank(2), 2, 0, false);
    }
}
