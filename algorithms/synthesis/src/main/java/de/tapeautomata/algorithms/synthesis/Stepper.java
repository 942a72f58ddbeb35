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

import de.tapeautomata.api.automaton.HexAlphabet;
import de.tapeautomata.api.program.Instruction;
import de.tapeautomata.api.program.Program;
import de.tapeautomata.datastructure.configuration.Configuration;

/**
 * Executes the instructions of a program, one at a time.
 *
 * The stepper never consumes input: when the next instruction is a read, it
 * hands the configuration back to its caller, which decides which symbol (if
 * any) is read by calling {@link #read(Configuration, int)}.
 *
 * @author Gaëtan Staquet
 */
public final class Stepper {
    private final Program program;

    public Stepper(Program program) {
        this.program = program;
    }

    public Program getProgram() {
        return program;
    }

    /**
     * Executes the instruction the configuration points to.
     *
     * @param configuration The current configuration
     * @return The outcome of the step
     */
    public StepOutcome step(Configuration configuration) {
        int position = configuration.getInstructionPointer();
        if (position >= program.size()) {
            return StepOutcome.halt();
        }

        Instruction instruction = program.getInstruction(position);
        switch (instruction) {
        case INCREMENT:
            return StepOutcome.advanced(configuration.incrementCurrentCell().advance());
        case DECREMENT:
            return StepOutcome.advanced(configuration.decrementCurrentCell().advance());
        case MOVE_RIGHT:
            return StepOutcome.advanced(configuration.moveHead(1).advance());
        case MOVE_LEFT:
            return StepOutcome.advanced(configuration.moveHead(-1).advance());
        case LOOP_OPEN:
            return loop(configuration, configuration.getCurrentCell() == 0);
        case LOOP_CLOSE:
            return loop(configuration, configuration.getCurrentCell() != 0);
        case ACCEPT_CHECK:
            return StepOutcome.markedAndAdvanced(configuration.withPendingAcceptance(true).advance());
        case READ:
            return StepOutcome.readAttempt(configuration);
        default:
            throw new IllegalStateException("Unknown instruction " + instruction);
        }
    }

    private StepOutcome loop(Configuration configuration, boolean jump) {
        if (!jump) {
            return StepOutcome.advanced(configuration.advance());
        }
        int target = program.getJumpTarget(configuration.getInstructionPointer());
        if (target == Program.UNMATCHED) {
            return StepOutcome.halt();
        }
        return StepOutcome.advanced(configuration.jumpTo(target));
    }

    /**
     * Performs a successful read: the symbol is written in the cell under the
     * head, the instruction pointer moves past the read and the pending-acceptance
     * flag is cleared.
     *
     * @param configuration The configuration of a {@link StepOutcome.Kind#READ_ATTEMPT}
     * @param symbol        The symbol read, between 0 and 15
     * @return The configuration after the read
     * @throws IllegalArgumentException if the configuration does not point to a
     *                                  read, or the symbol is not hexadecimal
     */
    public Configuration read(Configuration configuration, int symbol) {
        HexAlphabet.checkSymbol(symbol);
        int position = configuration.getInstructionPointer();
        if (position >= program.size() || program.getInstruction(position) != Instruction.READ) {
            throw new IllegalArgumentException("The configuration " + configuration + " does not point to a read");
        }
        return configuration.withCurrentCell(symbol).advance().withPendingAcceptance(false);
    }
}
