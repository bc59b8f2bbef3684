package com.visitor.kiosk.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.visitor.kiosk.conversation.CheckinStepResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CheckinStepResponse {

    private String nextPrompt;

    private String nextField;

    private Map<String, String> conversationState;

    @JsonProperty("is_complete")
    private boolean complete;

    private List<String> errors;

    public static CheckinStepResponse from(CheckinStepResult result) {
        return CheckinStepResponse.builder()
                .nextPrompt(result.getNextPrompt())
                .nextField(result.getNextField() != null ? result.getNextField().getKey() : null)
                .conversationState(result.getState())
                .complete(result.isComplete())
                .errors(result.hasErrors() ? result.getErrors() : null)
                .build();
    }
}
