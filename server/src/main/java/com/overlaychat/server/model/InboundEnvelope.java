package com.overlaychat.server.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotNull;

@JsonIgnoreProperties(ignoreUnknown = true)
public class InboundEnvelope {
    @NotNull
    public Integer cmd;

    public JsonNode data;
}
