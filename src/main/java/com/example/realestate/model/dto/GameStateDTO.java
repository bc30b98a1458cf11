package com.example.realestate.model.dto;

import com.example.realestate.model.domain.TurnEvent;
import lombok.Data;

import java.util.List;

@Data
public class GameStateDTO {
    private String gameId;
    private List<SpaceStateDTO> spaces;
    private List<PlayerStateDTO> players;
    private List<TurnEvent> history;
    private String winner; // empty while the game is still running
}
