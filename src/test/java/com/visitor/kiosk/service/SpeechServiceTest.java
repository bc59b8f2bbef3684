package com.visitor.kiosk.service;

import com.visitor.kiosk.provider.DisabledProviders;
import com.visitor.kiosk.provider.ProviderUnavailableException;
import com.visitor.kiosk.provider.SpeechToTextProvider;
import com.visitor.kiosk.provider.TextToSpeechProvider;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SpeechServiceTest {

    @Mock
    private SpeechToTextProvider sttProvider;

    @Mock
    private TextToSpeechProvider ttsProvider;

    @Test
    void transcribeDefaultsLanguage() {
        when(sttProvider.transcribe(any(byte[].class), eq("clip.webm"), eq("en-US"))).thenReturn("my name is Alice");

        Map<String, Object> result = new SpeechService(sttProvider, ttsProvider)
                .transcribe(new byte[]{1}, "clip.webm", null);

        assertThat(result)
                .containsEntry("transcript", "my name is Alice")
                .containsEntry("language", "en-US")
                .containsEntry("filename", "clip.webm");
    }

    @Test
    void failedTranscriptionYieldsDummyTranscript() {
        when(sttProvider.transcribe(any(byte[].class), any(), any()))
                .thenThrow(new ProviderUnavailableException("Speech recognition unreachable"));
        when(sttProvider.name()).thenReturn("openai-whisper");

        Map<String, Object> result = new SpeechService(sttProvider, ttsProvider)
                .transcribe(new byte[]{1}, "clip.wav", "de-DE");

        assertThat((String) result.get("transcript"))
                .startsWith("This is a dummy transcript of the audio (could not perform real STT:")
                .contains("Speech recognition unreachable");
        assertThat(result.get("language")).isEqualTo("de-DE");
    }

    @Test
    void synthesizeReturnsProviderAudio() {
        byte[] audio = {'R', 'I', 'F', 'F', 1, 2};
        when(ttsProvider.synthesize("Hello", "en")).thenReturn(Optional.of(audio));

        assertThat(new SpeechService(sttProvider, ttsProvider).synthesize("Hello", null)).isEqualTo(audio);
    }

    @Test
    void disabledSynthesisReturnsSilentWav() {
        SpeechService service = new SpeechService(new DisabledProviders.SpeechToText(), new DisabledProviders.TextToSpeech());

        byte[] wav = service.synthesize("Hello", "en");

        assertThat(wav).hasSize(44);
        assertThat(new String(wav, 0, 4)).isEqualTo("RIFF");
        assertThat(new String(wav, 8, 4)).isEqualTo("WAVE");
        // callers get their own copy
        wav[0] = 0;
        assertThat(SpeechService.SILENT_WAV[0]).isEqualTo((byte) 'R');
    }
}
