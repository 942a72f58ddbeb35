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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;

import de.learnlib.api.logging.LearnLogger;
import de.learnlib.api.statistic.StatisticCollector;
import de.learnlib.filter.statistic.Counter;
import de.tapeautomata.api.algorithm.AutomatonSynthesizer;
import de.tapeautomata.api.automaton.HexAlphabet;
import de.tapeautomata.api.program.Program;
import de.tapeautomata.datastructure.configuration.Configuration;

/**
 * Constructs the automaton recognizing the language of a program.
 *
 * The states of the automaton are the configurations observed right after a
 * successful read, plus the initial configuration. Each of them is closed by a
 * {@link ClosureEngine}:
 * <ul>
 * <li>If the closure reaches a read boundary, the state is accepting iff the
 * pending-acceptance flag is set, and, for every symbol, the configuration
 * obtained by reading that symbol is interned as the successor.</li>
 * <li>If the closure is a sealed halt, the state is sealed with the verdict of
 * the closure.</li>
 * </ul>
 * The configurations are explored breadth-first, so the initial state is
 * always {@code 0}. The exploration terminates since there are finitely many
 * configurations for a fixed program and tape length.
 *
 * Every call to {@link #build(Program, int)} is independent. The counters
 * accumulate over all the calls.
 *
 * @author Gaëtan Staquet
 */
public class AutomatonBuilder implements AutomatonSynthesizer<DefaultTapeAutomaton>, StatisticCollector {

    private static final LearnLogger LOGGER = LearnLogger.getLogger(AutomatonBuilder.class);

    private final Counter states = new Counter("automaton states", "#");
    private final Counter closures = new Counter("closure walks", "#");
    private final Counter steps = new Counter("executed instructions", "#");

    private int peakVisitedConfigurations;

    /**
     * @param program    The program
     * @param tapeLength The number of cells of the tape
     * @return The automaton
     * @throws de.tapeautomata.api.exception.InvalidTapeLengthException if the
     *         tape length is smaller than one
     */
    public DefaultTapeAutomaton build(Program program, int tapeLength) {
        Program.validateTapeLength(tapeLength);

        LOGGER.logPhase("Synthesizing the automaton of " + program + " with " + tapeLength + " cells");
        DefaultTapeAutomaton automaton = new BuildRun(program, tapeLength).run();
        LOGGER.logEvent("Synthesized " + automaton);

        return automaton;
    }

    @Override
    public DefaultTapeAutomaton synthesize(Program program, int tapeLength) {
        return build(program, tapeLength);
    }

    /**
     * @return The counter of created states
     */
    @Override
    public Counter getStatisticalData() {
        return states;
    }

    public Counter getClosureCounter() {
        return closures;
    }

    public Counter getStepCounter() {
        return steps;
    }

    /**
     * @return The largest number of configurations a single closure had to
     *         remember during the last build
     */
    public int getPeakVisitedConfigurations() {
        return peakVisitedConfigurations;
    }

    /**
     * The data of one synthesis. The map from configurations to states is owned by
     * the run and discarded with it.
     */
    private final class BuildRun {
        private final Stepper stepper;
        private final ClosureEngine closureEngine;
        private final int tapeLength;

        private final Map<Configuration, Integer> stateIds = new HashMap<>();
        private final List<Configuration> configurations = new ArrayList<>();
        private final Queue<Integer> pending = new ArrayDeque<>();

        private final List<Boolean> sealed = new ArrayList<>();
        private final List<Boolean> accepting = new ArrayList<>();
        private final List<int[]> successors = new ArrayList<>();

        BuildRun(Program program, int tapeLength) {
            this.stepper = new Stepper(program);
            this.closureEngine = new ClosureEngine(stepper);
            this.tapeLength = tapeLength;
        }

        DefaultTapeAutomaton run() {
            peakVisitedConfigurations = 0;
            int initialState = intern(Configuration.initial(tapeLength));

            while (!pending.isEmpty()) {
                resolve(pending.poll());
            }

            return freeze(initialState);
        }

        private int intern(Configuration configuration) {
            Integer id = stateIds.get(configuration);
            if (id != null) {
                return id;
            }

            int newId = configurations.size();
            stateIds.put(configuration, newId);
            configurations.add(configuration);
            sealed.add(false);
            accepting.add(false);
            successors.add(null);
            pending.add(newId);
            states.increment();
            return newId;
        }

        private void resolve(int state) {
            ClosureResult closure = closureEngine.close(configurations.get(state));
            closures.increment();
            steps.increment(closure.getSteps());
            peakVisitedConfigurations = Math.max(peakVisitedConfigurations, closure.getVisitedConfigurations());

            accepting.set(state, closure.isAccepting());
            if (closure.isSealed()) {
                sealed.set(state, true);
                return;
            }

            Configuration boundary = closure.getBoundary();
            int[] targets = new int[HexAlphabet.SIZE];
            for (int symbol = 0; symbol < HexAlphabet.SIZE; symbol++) {
                targets[symbol] = intern(stepper.read(boundary, symbol));
            }
            successors.set(state, targets);
        }

        private DefaultTapeAutomaton freeze(int initialState) {
            int size = configurations.size();
            boolean[] sealedArray = new boolean[size];
            boolean[] acceptingArray = new boolean[size];
            int[] successorArray = new int[size * HexAlphabet.SIZE];
            Arrays.fill(successorArray, DefaultTapeAutomaton.NO_SUCCESSOR);

            for (int state = 0; state < size; state++) {
                sealedArray[state] = sealed.get(state);
                acceptingArray[state] = accepting.get(state);
                int[] targets = successors.get(state);
                if (targets != null) {
                    System.arraycopy(targets, 0, successorArray, state * HexAlphabet.SIZE, HexAlphabet.SIZE);
                }
            }

            return new DefaultTapeAutomaton(initialState, sealedArray, acceptingArray, successorArray);
        }
    }
}
