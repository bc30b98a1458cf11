package com.example.realestate.model.domain;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Data
public class Game {

    public static final int MAX_HISTORY = 500;

    private String gameId;
    private Board board; // null until spaces are created
    private Map<String, Player> players = new LinkedHashMap<>();
    private List<TurnEvent> history = new ArrayList<>(); // most recent MAX_HISTORY events

    public Game() {
        this.gameId = UUID.randomUUID().toString();
    }

    public Player getPlayer(String name) {
        return players.get(name);
    }

    public boolean hasPlayer(String name) {
        return players.containsKey(name);
    }

    public void addPlayer(Player player) {
        players.put(player.getName(), player);
    }

    public void record(String playerName, TurnEventType type, int position, int amount, String counterparty) {
        history.add(new TurnEvent(playerName, type, position, amount, counterparty, System.currentTimeMillis()));
        if (history.size() > MAX_HISTORY) {
            history.remove(0);
        }
    }
}
