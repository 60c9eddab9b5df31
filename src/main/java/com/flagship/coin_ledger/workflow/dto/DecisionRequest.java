package com.flagship.coin_ledger.workflow.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.coin_ledger.subject.ModeratedSubject;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class DecisionRequest {

    @Size(max = ModeratedSubject.MAX_NOTE_LENGTH, message = "Note must be at most 1000 characters")
    @JsonProperty("note")
    String note;
}
