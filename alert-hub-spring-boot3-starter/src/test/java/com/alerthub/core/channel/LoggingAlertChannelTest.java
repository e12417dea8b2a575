package com.alerthub.core.channel;

import com.alerthub.core.serializer.JacksonAlertSerializer;
import com.alerthub.core.spi.AlertSerializer;
import com.alerthub.model.Alert;
import com.alerthub.model.enums.AlertSeverity;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class LoggingAlertChannelTest {

    @Test
    void sendsEverySeverityWithoutFailing() {
        LoggingAlertChannel channel = new LoggingAlertChannel(AlertSeverity.DEBUG, null);

        for (AlertSeverity s : AlertSeverity.values()) {
            assertTrue(channel.sendAsync(Alert.create("m", s, "svc"), "cid").isDone());
        }
        assertEquals("log", channel.name());
        assertTrue(channel.isHealthy());
    }

    @Test
    void jsonModeRendersThroughSerializer() {
        AlertSerializer serializer = spy(new JacksonAlertSerializer());
        LoggingAlertChannel channel = new LoggingAlertChannel(AlertSeverity.INFO, serializer);
        Alert alert = Alert.create("m", AlertSeverity.ERROR, "svc");

        channel.sendAsync(alert, "cid").join();

        verify(serializer).serialize(alert);
    }

    @Test
    void canBeDisabled() {
        LoggingAlertChannel channel = new LoggingAlertChannel(AlertSeverity.WARNING, null);
        channel.setEnabled(false);

        assertFalse(channel.isEnabled());
        assertEquals(AlertSeverity.WARNING, channel.minimumSeverity());
    }
}
