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
package de.tapeautomata.util;

import org.checkerframework.checker.nullness.qual.Nullable;

import de.learnlib.api.logging.LearnLogger;
import de.learnlib.api.statistic.StatisticCollector;
import de.learnlib.filter.statistic.Counter;
import de.learnlib.util.statistics.SimpleProfiler;
import de.tapeautomata.api.algorithm.AutomatonSynthesizer;
import de.tapeautomata.api.automaton.TapeAutomaton;
import de.tapeautomata.api.program.Program;
import de.tapeautomata.util.writer.TapeAutomatonASCIIWriter;

/**
 * Synthesizes the automaton of a program for a fixed tape length.
 * 
 * An experiment can be run only once. It keeps the synthesized automaton, and
 * can profile the synthesis and log the automaton.
 * 
 * @param <A> Automaton type
 * @author Gaëtan Staquet
 */
public final class SynthesisExperiment<A extends TapeAutomaton> {

    public static final String SYNTHESIS_PROFILE_KEY = "Synthesizing automaton";

    private static final LearnLogger LOGGER = LearnLogger.getLogger(SynthesisExperiment.class);

    private final Counter runs = new Counter("synthesis runs", "#");
    private final AutomatonSynthesizer<A> synthesizer;
    private final Program program;
    private final int tapeLength;

    private boolean logModels;
    private boolean profile;
    private boolean started;

    private @Nullable A finalAutomaton;

    public SynthesisExperiment(AutomatonSynthesizer<A> synthesizer, Program program, int tapeLength) {
        this.synthesizer = synthesizer;
        this.program = program;
        this.tapeLength = tapeLength;
    }

    public Program getProgram() {
        return program;
    }

    public int getTapeLength() {
        return tapeLength;
    }

    public A getFinalAutomaton() {
        if (finalAutomaton == null) {
            throw new IllegalStateException("Experiment has not yet been run");
        }

        return finalAutomaton;
    }

    /**
     * @return The synthesized automaton
     * @throws IllegalStateException if the experiment was already run
     */
    public A run() {
        if (started) {
            throw new IllegalStateException("Experiment has already been run");
        }
        started = true;

        runs.increment();
        LOGGER.logPhase("Starting synthesis of " + program + " on " + tapeLength + " cells");

        profileStart(SYNTHESIS_PROFILE_KEY);
        final A automaton;
        try {
            automaton = synthesizer.synthesize(program, tapeLength);
        } finally {
            profileStop(SYNTHESIS_PROFILE_KEY);
        }

        if (synthesizer instanceof StatisticCollector) {
            LOGGER.logStatistic(((StatisticCollector) synthesizer).getStatisticalData());
        }

        if (logModels) {
            StringBuilder table = new StringBuilder();
            new TapeAutomatonASCIIWriter().write(automaton, table);
            LOGGER.logEvent("Synthesized automaton:" + System.lineSeparator() + table);
        }

        finalAutomaton = automaton;
        return automaton;
    }

    private void profileStart(String taskname) {
        if (profile) {
            SimpleProfiler.start(taskname);
        }
    }

    private void profileStop(String taskname) {
        if (profile) {
            SimpleProfiler.stop(taskname);
        }
    }

    /**
     * @param logModels flag whether the automaton should be logged
     */
    public void setLogModels(boolean logModels) {
        this.logModels = logModels;
    }

    /**
     * @param profile flag whether the synthesis should be profiled
     */
    public void setProfile(boolean profile) {
        this.profile = profile;
    }

    public Counter getRuns() {
        return runs;
    }
}
