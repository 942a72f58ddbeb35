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
 * Thrown when a tape length is smaller than one.
 *
 * @author Gaëtan Staquet
 */
public class InvalidTapeLengthException extends MalformedProgramException {

    private static final long serialVersionUID = 1L;

    private final int tapeLength;

    public InvalidTapeLengthException(int tapeLength) {
        super("The tape must have at least one cell, got " + tapeLength);
        this.tapeLength = tapeLength;
    }

    public int getTapeLength() {
        return tapeLength;
    }
}
