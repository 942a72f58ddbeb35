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
package de.tapeautomata.api.exception;

/**
 * Signals that a program, or the tape it should run on, can not be turned into
 * an automaton.
 *
 * Unmatched loop instructions and programs that never halt are not malformed:
 * their behavior is part of the recognized language.
 *
 * @author Gaëtan Staquet
 */
public class MalformedProgramException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public MalformedProgramException(String message) {
        super(message);
    }
}
