package com.visitor.kiosk.controller;

import com.visitor.kiosk.entity.Host;
import com.visitor.kiosk.entity.VisitLog;
import com.visitor.kiosk.entity.Visitor;
import com.visitor.kiosk.service.CheckinInterviewService;
import com.visitor.kiosk.service.FieldValidationService;
import com.visitor.kiosk.service.VisitService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(VisitorController.class)
@Import({CheckinInterviewService.class, FieldValidationService.class})
class VisitorControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private VisitService visitService;

    @Test
    void checkinStepReturnsNextPromptInSnakeCase() throws Exception {
        String body = "{\"conversation_state\":{},\"user_input\":\"Alice Smith\",\"input_mode\":\"text\"}";

        mockMvc.perform(post("/api/visitor/checkin-step")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.next_field").value("email"))
                .andExpect(jsonPath("$.next_prompt").value("What is your email address? (You may skip)"))
                .andExpect(jsonPath("$.conversation_state.full_name").value("Alice Smith"))
                .andExpect(jsonPath("$.is_complete").value(false))
                .andExpect(jsonPath("$.errors").value(nullValue()));
    }

    @Test
    void checkinStepReportsInvalidEmail() throws Exception {
        String body = "{\"conversation_state\":{\"full_name\":\"Alice Smith\"},"
                + "\"user_input\":\"not-an-email\",\"input_mode\":\"voice\"}";

        mockMvc.perform(post("/api/visitor/checkin-step")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.conversation_state.email").value("not-an-email"))
                .andExpect(jsonPath("$.errors[0]").value("Invalid email format."))
                .andExpect(jsonPath("$.next_field").value("phone"));
    }

    @Test
    void finalizeWithoutFullNameIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/visitor/checkin-finalize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"alice@example.com\",\"host_email\":\"bob@example.com\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Missing required check-in fields."));
        verifyNoInteractions(visitService);
    }

    @Test
    void finalizeReturnsVisitLogWithParties() throws Exception {
        Visitor visitor = Visitor.builder().id(1L).fullName("Alice Smith").email("alice@example.com")
                .createdAt(Instant.parse("2024-05-01T09:00:00Z")).build();
        Host host = Host.builder().id(2L).fullName("bob").email("bob@example.com").build();
        VisitLog visit = VisitLog.builder().id(3L).visitor(visitor).host(host).purpose("Interview")
                .checkInTime(Instant.parse("2024-05-01T09:05:00Z")).status(VisitLog.Status.CHECKED_IN).build();
        when(visitService.finalizeCheckin(anyMap())).thenReturn(visit);

        mockMvc.perform(post("/api/visitor/checkin-finalize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"full_name\":\"Alice Smith\",\"email\":\"alice@example.com\","
                                + "\"host_email\":\"bob@example.com\",\"purpose\":\"Interview\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(3))
                .andExpect(jsonPath("$.status").value("checked_in"))
                .andExpect(jsonPath("$.visitor.full_name").value("Alice Smith"))
                .andExpect(jsonPath("$.host.email").value("bob@example.com"))
                .andExpect(jsonPath("$.check_out_time").value(nullValue()));
    }

    @Test
    void checkoutOfUnknownVisitIsNotFound() throws Exception {
        when(visitService.checkOut(42L)).thenThrow(new IllegalArgumentException("Visit log not found: 42"));

        mockMvc.perform(post("/api/visitor/visitlogs/42/checkout"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.detail").value("Visit log not found: 42"));
    }

    @Test
    void cancellingACheckedOutVisitIsAConflict() throws Exception {
        when(visitService.cancel(7L)).thenThrow(new IllegalStateException("Visit is checked_out"));

        mockMvc.perform(post("/api/visitor/visitlogs/7/cancel"))
                .andExpect(status().isConflict());
    }
}
