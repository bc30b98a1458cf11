package com.example.realestate.service;

import com.example.realestate.exception.GameNotFoundException;
import com.example.realestate.logic.GameEngine;
import com.example.realestate.model.domain.Board;
import com.example.realestate.model.domain.Game;
import com.example.realestate.model.dto.GameStateDTO;
import com.example.realestate.model.dto.PlayerStateDTO;
import com.example.realestate.model.dto.SpaceStateDTO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Keeps the running games in memory. The engine has no locking of its own,
 * so every call that touches a game holds that game's monitor.
 */
@Service
public class GameService {

    private static final Logger log = LoggerFactory.getLogger(GameService.class);

    private final Map<String, GameEngine> activeGames = new ConcurrentHashMap<>();

    @Value("${game.default-go-payout:200}")
    private int defaultGoPayout;

    @Value("${game.default-rent:50}")
    private int defaultRent;

    @Value("${game.default-starting-balance:1000}")
    private int defaultStartingBalance;

    public String createGame(Integer goPayout, List<Integer> rents) {
        GameEngine engine = new GameEngine();
        engine.createSpaces(goPayout != null ? goPayout : defaultGoPayout,
                rents != null ? rents : Collections.nCopies(Board.RENT_COUNT, defaultRent));

        String gameId = engine.getGame().getGameId();
        activeGames.put(gameId, engine);
        log.info("Created game {}", gameId);
        return gameId;
    }

    public void removeGame(String gameId) {
        if (activeGames.remove(gameId) == null) {
            throw new GameNotFoundException(gameId);
        }
        log.info("Removed game {}", gameId);
    }

    public boolean createPlayer(String gameId, String name, Integer startingBalance) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Player name is required");
        }
        GameEngine engine = findEngine(gameId);
        synchronized (engine.getGame()) {
            return engine.createPlayer(name, startingBalance != null ? startingBalance : defaultStartingBalance);
        }
    }

    public void movePlayer(String gameId, String name, int spaces) {
        GameEngine engine = findEngine(gameId);
        synchronized (engine.getGame()) {
            engine.movePlayer(name, spaces);
        }
    }

    public boolean buySpace(String gameId, String name) {
        GameEngine engine = findEngine(gameId);
        synchronized (engine.getGame()) {
            return engine.buySpace(name);
        }
    }

    public String checkGameOver(String gameId) {
        GameEngine engine = findEngine(gameId);
        synchronized (engine.getGame()) {
            return engine.checkGameOver();
        }
    }

    public PlayerStateDTO getPlayerState(String gameId, String name) {
        GameEngine engine = findEngine(gameId);
        synchronized (engine.getGame()) {
            return PlayerStateDTO.from(engine.getPlayer(name));
        }
    }

    public GameStateDTO getGameState(String gameId) {
        GameEngine engine = findEngine(gameId);
        synchronized (engine.getGame()) {
            return mapToDTO(engine);
        }
    }

    private GameEngine findEngine(String gameId) {
        GameEngine engine = activeGames.get(gameId);
        if (engine == null) {
            throw new GameNotFoundException(gameId);
        }
        return engine;
    }

    private GameStateDTO mapToDTO(GameEngine engine) {
        Game game = engine.getGame();
        GameStateDTO dto = new GameStateDTO();
        dto.setGameId(game.getGameId());
        dto.setSpaces(engine.getBoard().getSpaces().stream()
                .map(SpaceStateDTO::from)
                .collect(Collectors.toList()));
        dto.setPlayers(engine.getPlayers().stream()
                .map(PlayerStateDTO::from)
                .collect(Collectors.toList()));
        dto.setHistory(new ArrayList<>(engine.getHistory()));
        dto.setWinner(engine.checkGameOver());
        return dto;
    }
}
