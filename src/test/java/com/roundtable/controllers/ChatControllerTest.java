package com.roundtable.controllers;

import com.roundtable.models.ChatMode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ChatControllerTest {

    @Test
    void blankModeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ChatController.requireMode(null));
        assertThrows(IllegalArgumentException.class, () -> ChatController.requireMode(""));
        assertThrows(IllegalArgumentException.class, () -> ChatController.requireMode("   "));
    }

    @Test
    void unknownModeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ChatController.requireMode("Debate"));
    }

    @Test
    void modeAcceptsLabelOrName() {
        assertEquals(ChatMode.ROUND_TABLE, ChatController.requireMode("Round Table"));
        assertEquals(ChatMode.STANDARD, ChatController.requireMode("STANDARD"));
    }

    @Test
    void errorBodyFallsBackToExceptionName() {
        assertEquals("IllegalStateException", Controller.errorBody(new IllegalStateException()).get("error"));
        assertEquals("Chat mode is required",
            Controller.errorBody(new IllegalArgumentException("Chat mode is required")).get("error"));
    }
}
