package com.visitor.kiosk.service;

import com.visitor.kiosk.entity.Host;
import com.visitor.kiosk.repository.HostRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HostNotificationServiceTest {

    @Mock
    private HostRepository hostRepository;

    @Mock
    private TwilioSmsSender smsSender;

    private HostNotificationService service;

    @BeforeEach
    void setUp() {
        service = new HostNotificationService(hostRepository, smsSender);
    }

    @Test
    void hostWithPhoneGetsSms() {
        when(hostRepository.findByEmail("bob@example.com")).thenReturn(Optional.of(
                Host.builder().email("bob@example.com").phone("+15550100").build()));
        when(smsSender.isEnabled()).thenReturn(true);

        assertThat(service.notifyHost("bob@example.com", "Alice Smith")).isEqualTo(HostNotificationService.CHANNEL_SMS);
        verify(smsSender).send(eq("+15550100"), contains("Alice Smith"));
    }

    @Test
    void unknownHostIsLoggedOnly() {
        when(hostRepository.findByEmail("nobody@example.com")).thenReturn(Optional.empty());

        assertThat(service.notifyHost("nobody@example.com", "Alice Smith")).isEqualTo(HostNotificationService.CHANNEL_LOG);
        verify(smsSender, never()).send(anyString(), anyString());
    }

    @Test
    void smsFailureFallsBackToLog() {
        when(hostRepository.findByEmail("bob@example.com")).thenReturn(Optional.of(
                Host.builder().email("bob@example.com").phone("+15550100").build()));
        when(smsSender.isEnabled()).thenReturn(true);
        when(smsSender.send(anyString(), anyString())).thenThrow(new IllegalStateException("Twilio down"));

        assertThat(service.notifyHost("bob@example.com", "Alice Smith")).isEqualTo(HostNotificationService.CHANNEL_LOG);
    }
}
