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
package de.tapeautomata.examples;

/**
 * The program {@code .}: the machine marks the run as accepting and halts
 * before reading anything. Every word is accepted.
 *
 * @author Gaëtan Staquet
 */
public class ExampleAcceptEverything extends DefaultSynthesisExample {

    public static final String PROGRAM = ".";

    public ExampleAcceptEverything() {
        super(PROGRAM, 1, constantReference(true));
    }

    public static ExampleAcceptEverything createExample() {
        return new ExampleAcceptEverything();
    }
}
