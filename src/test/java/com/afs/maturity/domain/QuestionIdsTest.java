package com.afs.maturity.domain;

import com.afs.maturity.domain.CatalogModels.Question;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QuestionIdsTest {

    @Test
    void recognisesChecklistItems() {
        assertTrue(QuestionIds.isChecklistItem("FC-AIT-01A"));
        assertTrue(QuestionIds.isChecklistItem("FC-AIT-12F"));
        assertFalse(QuestionIds.isChecklistItem("FC-AIT-01G"));
        assertFalse(QuestionIds.isChecklistItem("FC-AIT-1A"));
        assertFalse(QuestionIds.isChecklistItem("FC-AIT-01"));
        assertFalse(QuestionIds.isChecklistItem(null));
        assertFalse(QuestionIds.isChecklistItem("A"));
    }

    @Test
    void stripsSuffixForBaseId() {
        assertEquals("FC-AIT-01", QuestionIds.baseId("FC-AIT-01C"));
        assertEquals("GATE-Q1", QuestionIds.baseId("GATE-Q1"));
    }

    @Test
    void infersSubLevelFromSuffix() {
        assertEquals(1, QuestionIds.subLevel("X-01A"));
        assertEquals(1, QuestionIds.subLevel("X-01B"));
        assertEquals(2, QuestionIds.subLevel("X-01C"));
        assertEquals(3, QuestionIds.subLevel("X-01D"));
        assertEquals(3, QuestionIds.subLevel("X-01E"));
        assertEquals(4, QuestionIds.subLevel("X-01F"));
        assertEquals(1, QuestionIds.subLevel("X-01"));
    }

    @Test
    void binaryByIdOrByTwoLevelDescriptions() {
        Question checklist = new Question("FC-AIT-01D", "AR", "q", 1, true, null, null, null, null);
        Question twoLevel = new Question("Q-PLAIN", "AR", "q", 1, true, "No", "Yes", null, null);
        Question graded = new Question("Q-GRADED", "AR", "q", 1, true, "1", "2", "3", "4");
        Question blank = new Question("Q-BLANK", "AR", "q", 1, true, "No", " ", null, null);

        assertTrue(checklist.binary());
        assertEquals(3, checklist.binarySubLevel());
        assertEquals(1.0, checklist.binaryWeight());
        assertTrue(twoLevel.binary());
        assertFalse(graded.binary());
        assertEquals(0.0, graded.binaryWeight());
        assertFalse(blank.binary());
    }
}
