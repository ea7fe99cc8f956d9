package com.ospicorp.energyapi.consumption.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.ospicorp.energyapi.alert.model.Alert;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CurrentConsumption(Reading reading, double threshold, Alert alert) {}
