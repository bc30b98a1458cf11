package com.example.realestate.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class CreateGameRequest {
    private Integer goPayout; // null = configured default
    private List<Integer> rents; // null = configured default for every space
}
