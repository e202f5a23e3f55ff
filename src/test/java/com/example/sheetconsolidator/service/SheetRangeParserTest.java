package com.example.sheetconsolidator.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SheetRangeParserTest {

    private final SheetRangeParser parser = new SheetRangeParser();

    @Test
    void dashRangeIsContiguousAndZeroBased() {
        assertThat(parser.parse("2-5", 10)).containsExactly(1, 2, 3, 4);
    }

    @Test
    void dashRangeProducesOneIndexPerSheet() {
        for (int start = 1; start <= 6; start++) {
            for (int end = start; end <= 6; end++) {
                List<Integer> indexes = parser.parse(start + "-" + end, 6);
                assertThat(indexes).hasSize(end - start + 1);
                assertThat(indexes.get(0)).isEqualTo(start - 1);
                assertThat(indexes).isSorted();
                assertThat(indexes.get(indexes.size() - 1)).isEqualTo(end - 1);
            }
        }
    }

    @Test
    void singleSheetDashRange() {
        assertThat(parser.parse("3-3", 3)).containsExactly(2);
    }

    @Test
    void commaListKeepsOrderAndDuplicates() {
        assertThat(parser.parse("5,1,3,3", 5)).containsExactly(4, 0, 2, 2);
    }

    @Test
    void singleNumberIsACommaList() {
        assertThat(parser.parse("4", 4)).containsExactly(3);
    }

    @Test
    void whitespaceAroundNumbersIsAllowed() {
        assertThat(parser.parse(" 1 , 2 ", 2)).containsExactly(0, 1);
        assertThat(parser.parse("1 - 2", 2)).containsExactly(0, 1);
    }

    @ParameterizedTest
    @ValueSource(strings = {"0-3", "1-100", "3-1", "abc", "1,11", "0", "1,,2", "1-2-3", "-2", "1-", ""})
    void rejectsInvalidExpressions(String expression) {
        assertThatThrownBy(() -> parser.parse(expression, 10))
                .isInstanceOf(InvalidRangeException.class)
                .satisfies(e -> {
                    InvalidRangeException invalid = (InvalidRangeException) e;
                    assertThat(invalid.getRangeExpression()).isEqualTo(expression);
                    assertThat(invalid.getSheetCount()).isEqualTo(10);
                });
    }

    @Test
    void messageNamesExpressionAndBound() {
        assertThatThrownBy(() -> parser.parse("1-100", 10))
                .hasMessageContaining("1-100")
                .hasMessageContaining("10 sheets");
    }

    @Test
    void rejectsNull() {
        assertThatThrownBy(() -> parser.parse(null, 3)).isInstanceOf(InvalidRangeException.class);
    }
}
