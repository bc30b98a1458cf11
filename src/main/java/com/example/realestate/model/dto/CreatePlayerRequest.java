package com.example.realestate.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class CreatePlayerRequest {
    private String name;
    private Integer startingBalance;
}
