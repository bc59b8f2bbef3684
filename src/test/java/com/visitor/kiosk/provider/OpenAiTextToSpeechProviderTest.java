package com.visitor.kiosk.provider;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OpenAiTextToSpeechProviderTest {

    private MockRestServiceServer server;
    private OpenAiTextToSpeechProvider provider;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        provider = new OpenAiTextToSpeechProvider(restTemplate,
                OpenAiSettings.builder().apiKey("sk-test").baseUrl("https://openai.test/v1").build());
    }

    @Test
    void returnsWavBytes() {
        byte[] wav = {'R', 'I', 'F', 'F', 0, 0};
        server.expect(requestTo("https://openai.test/v1/audio/speech"))
                .andExpect(jsonPath("$.input").value("Welcome to reception"))
                .andExpect(jsonPath("$.voice").value("alloy"))
                .andExpect(jsonPath("$.response_format").value("wav"))
                .andRespond(withSuccess(wav, MediaType.APPLICATION_OCTET_STREAM));

        assertThat(provider.synthesize("Welcome to reception", "en")).hasValueSatisfying(audio -> assertThat(audio).isEqualTo(wav));
        server.verify();
    }

    @Test
    void failureIsEmpty() {
        server.expect(requestTo("https://openai.test/v1/audio/speech")).andRespond(withServerError());

        assertThat(provider.synthesize("Welcome", "en")).isEmpty();
    }

    @Test
    void blankTextSkipsTheApi() {
        assertThat(provider.synthesize("  ", "en")).isEmpty();
        server.verify();
    }
}
