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
package de.tapeautomata.examples.cli;

import java.io.IOException;
import java.io.PrintStream;

import de.learnlib.util.statistics.SimpleProfiler;
import de.tapeautomata.algorithms.synthesis.AutomatonBuilder;
import de.tapeautomata.algorithms.synthesis.DefaultTapeAutomaton;
import de.tapeautomata.api.exception.MalformedProgramException;
import de.tapeautomata.api.program.Program;
import de.tapeautomata.util.SynthesisExperiment;
import de.tapeautomata.util.TapeAutomata;
import de.tapeautomata.util.writer.TapeAutomatonASCIIWriter;

/**
 * Synthesizes the automaton of the program given on the command line.
 * 
 * Usage: {@code TapeAutomatonExample <tape-length> <program>}
 * 
 * @author Gaëtan Staquet
 */
public class TapeAutomatonExample {
    static final String USAGE = "Usage: TapeAutomatonExample <tape-length> <program>";

    private TapeAutomatonExample() {
    }

    public static void main(String[] args) throws IOException {
        int status = run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * @return The exit status
     */
    static int run(String[] args, PrintStream out, PrintStream err) throws IOException {
        if (args.length != 2) {
            err.println(USAGE);
            return 1;
        }

        final int tapeLength;
        final Program program;
        try {
            tapeLength = Integer.parseInt(args[0]);
            Program.validateTapeLength(tapeLength);
            program = Program.parse(args[1]);
        } catch (MalformedProgramException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return 1;
        } catch (NumberFormatException e) {
            err.println("Invalid tape length: " + args[0]);
            err.println(USAGE);
            return 1;
        }

        runExample(program, tapeLength, out);
        return 0;
    }

    private static void runExample(Program program, int tapeLength, PrintStream out) throws IOException {
        AutomatonBuilder builder = new AutomatonBuilder();

        SynthesisExperiment<DefaultTapeAutomaton> experiment = new SynthesisExperiment<>(builder, program,
                tapeLength);
        experiment.setLogModels(false);
        experiment.setProfile(true);

        experiment.run();

        DefaultTapeAutomaton result = experiment.getFinalAutomaton();

        out.println("-------------------------------------------------------");

        // profiling
        out.println(SimpleProfiler.getResults());

        // synthesis statistics
        out.println(experiment.getRuns().getSummary());
        out.println(builder.getStatisticalData().getSummary());
        out.println(builder.getClosureCounter().getSummary());
        out.println(builder.getStepCounter().getSummary());
        out.println("Peak visited configurations: " + builder.getPeakVisitedConfigurations());

        // model
        out.println("Program: " + program);
        out.println("Tape length: " + tapeLength);
        out.println();
        out.println("Transitions: ");
        new TapeAutomatonASCIIWriter().write(result, out);

        out.println();
        out.println("Model: ");
        TapeAutomata.writeDOT(result, out);

        out.println("-------------------------------------------------------");
    }
}
