package com.flagship.bounty_ledger.submission;

import com.flagship.bounty_ledger.collaborator.JudgeVerdict;
import com.flagship.bounty_ledger.exception.ConflictException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class SubmissionTest {

    private static Submission pending() {
        return Submission.create(UUID.randomUUID(), UUID.randomUUID(), ProofType.TEXT, "done", null);
    }

    @Test
    @DisplayName("Approved verdict records reasoning, score and verification time")
    void decide_Approved() {
        Submission decided = pending().decide(JudgeVerdict.of(true, 92, "Looks right", List.of()));

        assertEquals(SubmissionStatus.APPROVED, decided.getStatus());
        assertEquals(92, decided.getVerdictScore());
        assertEquals("Looks right", decided.getVerdictReasoning());
        assertNotNull(decided.getVerifiedAt());
        assertTrue(decided.isApproved());
        assertFalse(decided.isPending());
    }

    @Test
    @DisplayName("Out-of-range judge scores are clamped")
    void decide_ClampsScore() {
        assertEquals(100, pending().decide(JudgeVerdict.of(true, 140, "r", null)).getVerdictScore());
        assertEquals(0, pending().decide(JudgeVerdict.of(false, -3, "r", null)).getVerdictScore());
    }

    @Test
    @DisplayName("A submission is decided at most once")
    void decide_Twice_Conflict() {
        Submission rejected = pending().decide(JudgeVerdict.of(false, 10, "No", List.of()));

        assertEquals(SubmissionStatus.REJECTED, rejected.getStatus());
        assertThrows(ConflictException.class,
                () -> rejected.decide(JudgeVerdict.of(true, 99, "Yes", List.of())));
    }

    @Test
    @DisplayName("Only pending moves, and only to a verdict")
    void statusTransitions() {
        assertTrue(SubmissionStatus.PENDING.canTransitionTo(SubmissionStatus.APPROVED));
        assertTrue(SubmissionStatus.PENDING.canTransitionTo(SubmissionStatus.REJECTED));
        assertFalse(SubmissionStatus.PENDING.canTransitionTo(SubmissionStatus.PENDING));
        assertFalse(SubmissionStatus.APPROVED.canTransitionTo(SubmissionStatus.REJECTED));
        assertFalse(SubmissionStatus.REJECTED.canTransitionTo(SubmissionStatus.APPROVED));
    }
}
