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
package de.tapeautomata.util.writer;

import java.io.IOException;

import de.tapeautomata.api.automaton.HexAlphabet;
import de.tapeautomata.api.automaton.TapeAutomaton;

/**
 * ASCII-art transition table of a tape automaton.
 * 
 * Each row gives a state, whether it reads or is sealed, its acceptance
 * ({@code +} or {@code -}) and its successor for each symbol {@code 0} to
 * {@code f}. The successor columns of a sealed state are empty. The initial
 * state is marked with {@code >}.
 * 
 * @author Gaëtan Staquet
 */
public class TapeAutomatonASCIIWriter implements TapeAutomatonWriter {
    private static final int FIXED_COLUMNS = 3;

    private boolean rowSeparators;

    public TapeAutomatonASCIIWriter() {
        this(false);
    }

    public TapeAutomatonASCIIWriter(boolean rowSeparators) {
        this.rowSeparators = rowSeparators;
    }

    public void setRowSeparators(boolean rowSeparators) {
        this.rowSeparators = rowSeparators;
    }

    @Override
    public void write(TapeAutomaton automaton, Appendable out) throws IOException {
        final int numColumns = FIXED_COLUMNS + HexAlphabet.SIZE;
        final String[][] rows = new String[automaton.size() + 1][];

        String[] header = new String[numColumns];
        header[0] = "state";
        header[1] = "kind";
        header[2] = "acc";
        for (int symbol = 0; symbol < HexAlphabet.SIZE; symbol++) {
            header[FIXED_COLUMNS + symbol] = String.valueOf(Character.forDigit(symbol, HexAlphabet.SIZE));
        }
        rows[0] = header;

        for (int state = 0; state < automaton.size(); state++) {
            String[] content = new String[numColumns];
            content[0] = (state == automaton.getInitialState() ? ">" : "") + state;
            content[1] = automaton.isSealed(state) ? "sealed" : "read";
            content[2] = automaton.isAccepting(state) ? "+" : "-";
            for (int symbol = 0; symbol < HexAlphabet.SIZE; symbol++) {
                if (automaton.isSealed(state)) {
                    content[FIXED_COLUMNS + symbol] = "";
                } else {
                    content[FIXED_COLUMNS + symbol] = String.valueOf(automaton.getSuccessor(state, symbol));
                }
            }
            rows[state + 1] = content;
        }

        int[] colWidth = new int[numColumns];
        for (String[] row : rows) {
            for (int i = 0; i < numColumns; i++) {
                colWidth[i] = Math.max(colWidth[i], row[i].length());
            }
        }

        appendSeparatorRow(out, '=', colWidth);
        appendContentRow(out, rows[0], colWidth);
        appendSeparatorRow(out, '=', colWidth);

        for (int i = 1; i < rows.length; i++) {
            if (i > 1 && rowSeparators) {
                appendSeparatorRow(out, '-', colWidth);
            }
            appendContentRow(out, rows[i], colWidth);
        }

        appendSeparatorRow(out, '=', colWidth);
    }

    private static void appendSeparatorRow(Appendable a, char sepChar, int[] colWidth) throws IOException {
        a.append('+').append(sepChar);
        appendRepeated(a, sepChar, colWidth[0]);
        for (int i = 1; i < colWidth.length; i++) {
            a.append(sepChar).append('+').append(sepChar);
            appendRepeated(a, sepChar, colWidth[i]);
        }
        a.append(sepChar).append("+").append(System.lineSeparator());
    }

    private static void appendContentRow(Appendable a, String[] content, int[] colWidth) throws IOException {
        a.append("| ");
        appendRightPadded(a, content[0], colWidth[0]);
        for (int i = 1; i < content.length; i++) {
            a.append(" | ");
            appendRightPadded(a, content[i], colWidth[i]);
        }
        a.append(" |").append(System.lineSeparator());
    }

    private static void appendRepeated(Appendable a, char c, int count) throws IOException {
        for (int i = 0; i < count; i++) {
            a.append(c);
        }
    }

    private static void appendRightPadded(Appendable a, String string, int width) throws IOException {
        a.append(string);
        appendRepeated(a, ' ', width - string.length());
    }
}
