package com.flagship.bounty_ledger.collaborator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JudgeVerdictTest {

    @Test
    @DisplayName("Scores are clamped to 0..100 and rounded")
    void clampScore() {
        assertEquals(0, JudgeVerdict.clampScore(-12));
        assertEquals(100, JudgeVerdict.clampScore(150));
        assertEquals(73, JudgeVerdict.clampScore(72.6));
        assertEquals(0, JudgeVerdict.clampScore(Double.NaN));
    }

    @Test
    @DisplayName("Missing reasoning and suggestions get defaults; suggestions are copied")
    void of_Defaults() {
        JudgeVerdict verdict = JudgeVerdict.of(false, 40, " ", null);

        assertEquals("No reasoning provided", verdict.getReasoning());
        assertTrue(verdict.getSuggestions().isEmpty());

        List<String> suggestions = new ArrayList<>(List.of("Add a screenshot"));
        JudgeVerdict copied = JudgeVerdict.of(false, 40, "Blurry", suggestions);
        suggestions.clear();
        assertEquals(List.of("Add a screenshot"), copied.getSuggestions());
    }
}
