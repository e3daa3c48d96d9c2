package com.example.ledgeraudit.application.extract;

import com.example.ledgeraudit.domain.model.ColumnLayout;
import com.example.ledgeraudit.domain.model.RawLine;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Whitespace-delimited word of a row with its estimated horizontal position and column.
 *
 * @param index  position within the row, left to right
 * @param text   cleaned text
 * @param x      estimated start offset
 * @param column column index under the page layout
 */
public record Token(int index, String text, float x, int column) {

    /**
     * Splits fragments into cleaned tokens. Word positions inside a multi-word fragment are interpolated
     * by character offset across the fragment box.
     *
     * @param fragments row fragments
     * @param layout    page column layout
     * @param slack     column boundary tolerance
     * @return tokens ordered left to right, noise-only words removed
     */
    public static List<Token> split(List<RawLine> fragments, ColumnLayout layout, float slack) {
        List<RawLine> ordered = fragments.stream()
                .sorted(Comparator.comparing(RawLine::x))
                .toList();
        List<Token> tokens = new ArrayList<>();
        for (RawLine fragment : ordered) {
            String text = fragment.text();
            int length = Math.max(text.length(), 1);
            float charWidth = fragment.box().width() / length;
            int offset = 0;
            for (String word : text.split("\\s+")) {
                int start = text.indexOf(word, offset);
                if (word.isEmpty() || start < 0) {
                    continue;
                }
                offset = start + word.length();
                String cleaned = TokenCleaner.clean(word);
                if (cleaned.isEmpty()) {
                    continue;
                }
                float x = fragment.x() + (start * charWidth);
                tokens.add(new Token(tokens.size(), cleaned, x, layout.columnOf(x, slack)));
            }
        }
        return tokens;
    }

    public String upper() {
        return text.toUpperCase(Locale.ROOT);
    }
}
