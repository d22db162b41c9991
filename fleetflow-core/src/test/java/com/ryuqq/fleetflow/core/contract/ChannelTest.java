package com.ryuqq.fleetflow.core.contract;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ChannelTest {

    @Test
    void of_WellKnownName_EqualsConstant() {
        // Then
        assertEquals(Channel.ANALYSIS_REQUEST, Channel.of("analysis.request"));
        assertEquals("system.error", Channel.SYSTEM_ERROR.toString());
    }

    @Test
    void of_UppercaseName_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> Channel.of("Analysis.Request")
        );
        assertTrue(exception.getMessage().contains("invalid characters"));
    }

    @Test
    void stageChannels_FollowContextKeyNaming() {
        // Then
        for (Stage stage : Stage.values()) {
            assertEquals(stage.contextKey() + ".request", stage.requestChannel().toString());
            assertEquals(stage.contextKey() + ".result", stage.resultChannel().toString());
        }
    }
}
