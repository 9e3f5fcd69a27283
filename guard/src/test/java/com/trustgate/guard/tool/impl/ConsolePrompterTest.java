package com.trustgate.guard.tool.impl;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConsolePrompterTest {

    private static final List<String> OPTIONS = List.of("keep", "replace", "abort");

    @Test
    void choose_validNumber_picksThatOption() {
        assertThat(ConsolePrompter.choose("2", OPTIONS)).isEqualTo("replace");
        assertThat(ConsolePrompter.choose(" 3 ", OPTIONS)).isEqualTo("abort");
    }

    @Test
    void choose_emptyOrMissing_defaultsToFirst() {
        assertThat(ConsolePrompter.choose("", OPTIONS)).isEqualTo("keep");
        assertThat(ConsolePrompter.choose(null, OPTIONS)).isEqualTo("keep");
    }

    @Test
    void choose_outOfRangeOrGarbage_defaultsToFirst() {
        assertThat(ConsolePrompter.choose("0", OPTIONS)).isEqualTo("keep");
        assertThat(ConsolePrompter.choose("9", OPTIONS)).isEqualTo("keep");
        assertThat(ConsolePrompter.choose("replace", OPTIONS)).isEqualTo("keep");
    }
}
