package com.example.realestate.model.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TurnEvent {
    private String playerName;
    private TurnEventType type;
    private int position;
    private int amount;
    private String counterparty; // rent recipient, null otherwise
    private long timestamp;
}
