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
package de.tapeautomata.algorithms.synthesis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import de.tapeautomata.api.automaton.HexAlphabet;
import de.tapeautomata.api.exception.InvalidTapeLengthException;
import de.tapeautomata.api.program.Instruction;
import de.tapeautomata.api.program.Program;
import de.tapeautomata.examples.BenchmarkPrograms;
import de.tapeautomata.examples.ExampleAcceptEverything;
import de.tapeautomata.examples.ExampleEmptyWordOnly;
import de.tapeautomata.examples.ExampleEvenLength;
import de.tapeautomata.examples.ExampleRandomProgram;
import de.tapeautomata.examples.ExampleSilentLoop;
import de.tapeautomata.examples.ExampleUnmatchedClose;
import de.tapeautomata.examples.ExampleZeroFree;
import de.tapeautomata.examples.SynthesisExample;
import net.automatalib.automata.fsa.DFA;

public class AutomatonBuilderTest {

    @DataProvider(name = "examples")
    public static Object[][] examples() {
        // @formatter:off
        return new Object[][] {
            { ExampleEvenLength.createExample() },
            { ExampleZeroFree.createExample() },
            { new ExampleUnmatchedClose(1) },
            { new ExampleUnmatchedClose(3) },
            { new ExampleSilentLoop(1) },
            { new ExampleSilentLoop(2) },
            { ExampleAcceptEverything.createExample() },
            { ExampleEmptyWordOnly.createExample() },
        };
        // @formatter:on
    }

    @Test(dataProvider = "examples")
    public void testLanguageOfExamples(SynthesisExample example) {
        DefaultTapeAutomaton automaton = new AutomatonBuilder().build(example.getProgram(), example.getTapeLength());
        DFA<?, Integer> reference = example.getReferenceAutomaton();

        for (List<Integer> word : allWords(3)) {
            Assert.assertEquals(automaton.accepts(word), reference.accepts(word), example + " on " + word);
        }
        checkWellFormed(automaton);
    }

    @Test
    public void testEvenLength() {
        DefaultTapeAutomaton automaton = new AutomatonBuilder().build(Program.parse(ExampleEvenLength.PROGRAM),
                ExampleEvenLength.TAPE_LENGTH);

        Assert.assertTrue(automaton.accepts(""));
        Assert.assertTrue(automaton.accepts("a3"));
        Assert.assertTrue(automaton.accepts("ff00"));
        Assert.assertFalse(automaton.accepts("a"));
        Assert.assertFalse(automaton.accepts("a3c"));
    }

    @Test
    public void testZeroFree() {
        DefaultTapeAutomaton automaton = new AutomatonBuilder().build(Program.parse(ExampleZeroFree.PROGRAM),
                ExampleZeroFree.TAPE_LENGTH);

        Assert.assertTrue(automaton.accepts(""));
        Assert.assertTrue(automaton.accepts("1"));
        Assert.assertTrue(automaton.accepts("ff"));
        Assert.assertFalse(automaton.accepts("10"));
        Assert.assertFalse(automaton.accepts("0"));

        // Reading a zero leads to a state that never reads again
        int afterZero = automaton.getSuccessor(automaton.getInitialState(), 0);
        Assert.assertTrue(automaton.isSealed(afterZero));
        Assert.assertFalse(automaton.isAccepting(afterZero));
    }

    @Test
    public void testSingleSealedState() {
        checkSingleSealedState("]", 1, false);
        checkSingleSealedState("]", 4, false);
        checkSingleSealedState("+[]", 2, false);
        checkSingleSealedState(".", 1, true);
        checkSingleSealedState("+[.]", 1, true);
        checkSingleSealedState("+-", 1, false);
    }

    private static void checkSingleSealedState(String text, int tapeLength, boolean accepting) {
        DefaultTapeAutomaton automaton = new AutomatonBuilder().build(Program.parse(text), tapeLength);

        Assert.assertEquals(automaton.size(), 1, text);
        Assert.assertEquals(automaton.getInitialState(), 0);
        Assert.assertTrue(automaton.isSealed(0));
        Assert.assertEquals(automaton.isAccepting(0), accepting);
        Assert.assertEquals(automaton.accepts("0123"), accepting);
        Assert.expectThrows(IllegalStateException.class, () -> automaton.getSuccessor(0, 0));
    }

    @Test
    public void testReadEverything() {
        DefaultTapeAutomaton automaton = new AutomatonBuilder().build(Program.parse("+[,]"), 1);

        // The initial state, and one state per value written by the read
        Assert.assertEquals(automaton.size(), 17);
        Assert.assertFalse(automaton.accepts(""));
        Assert.assertFalse(automaton.accepts("12"));
        // Reading a zero exits the loop and reaches the end of the program
        Assert.assertFalse(automaton.accepts("30"));
        checkWellFormed(automaton);
    }

    @Test
    public void testIdempotence() {
        AutomatonBuilder builder = new AutomatonBuilder();
        Program program = Program.parse(ExampleZeroFree.PROGRAM);

        DefaultTapeAutomaton first = builder.build(program, ExampleZeroFree.TAPE_LENGTH);
        DefaultTapeAutomaton second = builder.build(program, ExampleZeroFree.TAPE_LENGTH);
        DefaultTapeAutomaton third = new AutomatonBuilder().synthesize(program, ExampleZeroFree.TAPE_LENGTH);

        Assert.assertEquals(second, first);
        Assert.assertEquals(third, first);
        Assert.assertEquals(third.hashCode(), first.hashCode());
    }

    @Test
    public void testInvalidTapeLength() {
        AutomatonBuilder builder = new AutomatonBuilder();
        Program program = Program.parse(ExampleEvenLength.PROGRAM);

        InvalidTapeLengthException exception = Assert.expectThrows(InvalidTapeLengthException.class,
                () -> builder.build(program, 0));
        Assert.assertEquals(exception.getTapeLength(), 0);
        Assert.expectThrows(InvalidTapeLengthException.class, () -> builder.build(program, -3));
        Assert.assertEquals(builder.getStatisticalData().getCount(), 0);
    }

    @Test
    public void testCounters() {
        AutomatonBuilder builder = new AutomatonBuilder();
        DefaultTapeAutomaton automaton = builder.build(Program.parse(ExampleEvenLength.PROGRAM),
                ExampleEvenLength.TAPE_LENGTH);

        Assert.assertEquals(builder.getStatisticalData().getCount(), automaton.size());
        Assert.assertEquals(builder.getClosureCounter().getCount(), automaton.size());
        Assert.assertTrue(builder.getStepCounter().getCount() > 0);

        builder.build(Program.parse(ExampleEvenLength.PROGRAM), ExampleEvenLength.TAPE_LENGTH);
        Assert.assertEquals(builder.getStatisticalData().getCount(), 2L * automaton.size());
    }

    @Test
    public void testPeakVisitedConfigurations() {
        AutomatonBuilder builder = new AutomatonBuilder();
        Program program = Program.parse("+[>+<]");
        builder.build(program, 2);

        Assert.assertTrue(builder.getPeakVisitedConfigurations() >= 16);
        Assert.assertTrue(builder.getPeakVisitedConfigurations() <= ClosureEngine.configurationBound(program, 2));
    }

    @DataProvider(name = "skippedLoops")
    public static Object[][] skippedLoops() {
        // @formatter:off
        return new Object[][] {
            { "[].", 1 },
            { "[+].", 1 },
            { "[,].,", 1 },
            { ",[.].,", 2 },
            { "+[-]>[<]+[.,]", 2 },
            { "[>+<[-]].,", 2 },
        };
        // @formatter:on
    }

    @Test(dataProvider = "skippedLoops")
    public void testSkippedLoopsAgainstInterpreter(String text, int tapeLength) {
        Program program = Program.parse(text);
        DefaultTapeAutomaton automaton = new AutomatonBuilder().build(program, tapeLength);

        for (List<Integer> word : allWords(2)) {
            Assert.assertEquals(automaton.accepts(word), interpret(program, tapeLength, word), text + " on " + word);
        }
    }

    @Test
    public void testJumpPastLoop() {
        // The instruction right after the skipped loop is executed
        Program program = Program.parse("[].");
        DefaultTapeAutomaton automaton = new AutomatonBuilder().build(program, 1);

        Assert.assertTrue(automaton.accepts(""));
        Assert.assertTrue(interpret(program, 1, Collections.emptyList()));
    }

    @Test
    public void testRandomPrograms() {
        Random random = new Random(42);
        for (int i = 0; i < 100; i++) {
            ExampleRandomProgram example = new ExampleRandomProgram(random, 1 + random.nextInt(8),
                    1 + random.nextInt(2));
            Program program = example.getProgram();
            int tapeLength = example.getTapeLength();
            DefaultTapeAutomaton automaton = new AutomatonBuilder().build(program, tapeLength);

            checkWellFormed(automaton);
            for (List<Integer> word : allWords(2)) {
                Assert.assertEquals(automaton.accepts(word), interpret(program, tapeLength, word),
                        example + " on " + word);
            }
        }
    }

    @Test(timeOut = 60000)
    public void testBenchmarkPrograms() {
        for (BenchmarkPrograms.Entry entry : BenchmarkPrograms.getPrograms()) {
            DefaultTapeAutomaton automaton = new AutomatonBuilder().build(entry.getProgram(), entry.getTapeLength());
            checkWellFormed(automaton);
        }
    }

    private static void checkWellFormed(DefaultTapeAutomaton automaton) {
        Assert.assertEquals(automaton.getInitialState(), 0);
        for (int state = 0; state < automaton.size(); state++) {
            if (automaton.isSealed(state)) {
                continue;
            }
            for (int symbol = 0; symbol < HexAlphabet.SIZE; symbol++) {
                int successor = automaton.getSuccessor(state, symbol);
                Assert.assertTrue(successor >= 0 && successor < automaton.size());
            }
        }
    }

    private static List<List<Integer>> allWords(int maxLength) {
        List<List<Integer>> words = new ArrayList<>();
        words.add(Collections.emptyList());
        int start = 0;
        for (int length = 1; length <= maxLength; length++) {
            int end = words.size();
            for (int i = start; i < end; i++) {
                for (int symbol = 0; symbol < HexAlphabet.SIZE; symbol++) {
                    List<Integer> word = new ArrayList<>(words.get(i));
                    word.add(symbol);
                    words.add(word);
                }
            }
            start = end;
        }
        return words;
    }

    /**
     * Runs the program directly on the word. A run that executes more than twice
     * the number of configurations without reading is considered as looping: its
     * flag can not change anymore.
     */
    private static boolean interpret(Program program, int tapeLength, List<Integer> word) {
        int[] tape = new int[tapeLength];
        int head = 0;
        int ip = 0;
        boolean flag = false;
        int nextSymbol = 0;
        long budget = 2 * ClosureEngine.configurationBound(program, tapeLength) + 2;
        long stepsSinceRead = 0;

        while (ip < program.size()) {
            if (stepsSinceRead++ > budget) {
                return flag;
            }
            Instruction instruction = program.getInstruction(ip);
            switch (instruction) {
            case INCREMENT:
                tape[head] = (tape[head] + 1) % 16;
                ip++;
                break;
            case DECREMENT:
                tape[head] = (tape[head] + 15) % 16;
                ip++;
                break;
            case MOVE_RIGHT:
                head = (head + 1) % tapeLength;
                ip++;
                break;
            case MOVE_LEFT:
                head = (head + tapeLength - 1) % tapeLength;
                ip++;
                break;
            case LOOP_OPEN:
            case LOOP_CLOSE:
                boolean jump = instruction == Instruction.LOOP_OPEN ? tape[head] == 0 : tape[head] != 0;
                if (!jump) {
                    ip++;
                } else if (!program.isMatched(ip)) {
                    return flag;
                } else {
                    ip = program.getJumpTarget(ip);
                }
                break;
            case ACCEPT_CHECK:
                flag = true;
                ip++;
                break;
            case READ:
                if (nextSymbol == word.size()) {
                    return flag;
                }
                tape[head] = word.get(nextSymbol++);
                flag = false;
                stepsSinceRead = 0;
                ip++;
                break;
            default:
                throw new IllegalStateException();
            }
        }
        return flag;
    }
}
