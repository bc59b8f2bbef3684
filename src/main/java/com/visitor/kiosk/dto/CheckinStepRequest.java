package com.visitor.kiosk.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One question/answer round of the conversational check-in.
 */
@Getter
@Setter
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CheckinStepRequest {

    /** Answers collected so far, echoed back by the kiosk on every step. */
    private Map<String, String> conversationState = new LinkedHashMap<>();

    /** Raw spoken or typed answer. */
    private String userInput;

    /** "voice" or "text" */
    private String inputMode;
}
