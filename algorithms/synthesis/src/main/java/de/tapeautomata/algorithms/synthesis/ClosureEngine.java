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

import java.util.HashSet;
import java.util.Set;

import de.tapeautomata.algorithms.synthesis.ClosureResult.HaltCause;
import de.tapeautomata.api.program.Program;
import de.tapeautomata.datastructure.configuration.Configuration;

/**
 * Runs a machine from a read boundary until its next terminal event.
 *
 * Starting from the configuration right after a successful read (or the
 * initial configuration), the engine applies the {@link Stepper} until one of
 * the following happens:
 * <ul>
 * <li>the next instruction is a read: the result is a read boundary;</li>
 * <li>the machine halts: the result is a sealed halt;</li>
 * <li>a configuration repeats: the machine loops forever without reading, and
 * the result is a sealed halt as well.</li>
 * </ul>
 * The acceptance of the result is the pending-acceptance flag at that moment.
 *
 * Cycles are detected with the set of all the configurations (flag included)
 * seen during the walk. The flag never goes back to false during a walk, so the
 * configurations seen before it is set can not repeat afterwards and are
 * dropped. Hence the set never holds more than {@code 16^L * L * |program|}
 * configurations, with {@code L} the length of the tape.
 *
 * @author Gaëtan Staquet
 */
public final class ClosureEngine {
    private final Stepper stepper;

    public ClosureEngine(Program program) {
        this(new Stepper(program));
    }

    public ClosureEngine(Stepper stepper) {
        this.stepper = stepper;
    }

    public Stepper getStepper() {
        return stepper;
    }

    /**
     * @param start A read boundary configuration, with the pending-acceptance flag
     *              cleared
     * @return How the walk ended
     * @throws IllegalArgumentException if the pending-acceptance flag is set
     */
    public ClosureResult close(Configuration start) {
        if (start.isPendingAcceptance()) {
            throw new IllegalArgumentException("A closure must start with a cleared pending-acceptance flag");
        }

        final Set<Configuration> visited = new HashSet<>();
        int peakVisited = 0;
        int steps = 0;
        Configuration current = start;

        while (true) {
            StepOutcome outcome = stepper.step(current);
            switch (outcome.getKind()) {
            case READ_ATTEMPT:
                return ClosureResult.readBoundary(outcome.getConfiguration(), steps, peakVisited);
            case UNCONDITIONAL_HALT:
                return ClosureResult.sealedHalt(haltCause(current), current.isPendingAcceptance(), steps,
                        peakVisited);
            case MARKED_AND_ADVANCED:
                if (!current.isPendingAcceptance()) {
                    // Nothing seen so far can repeat once the flag is set
                    visited.clear();
                    current = outcome.getConfiguration();
                    steps++;
                    continue;
                }
                break;
            case ADVANCED:
                break;
            default:
                throw new IllegalStateException("Unknown step outcome " + outcome);
            }

            // Only configurations that execute an instruction are remembered: the
            // others end the walk on their first visit
            if (!visited.add(current)) {
                return ClosureResult.sealedHalt(HaltCause.NON_TERMINATION, current.isPendingAcceptance(), steps,
                        peakVisited);
            }
            peakVisited = Math.max(peakVisited, visited.size());

            current = outcome.getConfiguration();
            steps++;
        }
    }

    private HaltCause haltCause(Configuration halted) {
        if (halted.getInstructionPointer() >= stepper.getProgram().size()) {
            return HaltCause.END_OF_PROGRAM;
        }
        return HaltCause.UNMATCHED_JUMP;
    }

    /**
     * @param program    The program
     * @param tapeLength The number of cells
     * @return The number of distinct configurations with a given pending-acceptance
     *         flag, that is, {@code 16^L * L * |program|}, saturated at
     *         {@link Long#MAX_VALUE}
     */
    public static long configurationBound(Program program, int tapeLength) {
        long bound = (long) tapeLength * program.size();
        for (int i = 0; i < tapeLength; i++) {
            if (bound > Long.MAX_VALUE / 16) {
                return Long.MAX_VALUE;
            }
            bound *= 16;
        }
        return bound;
    }
}
