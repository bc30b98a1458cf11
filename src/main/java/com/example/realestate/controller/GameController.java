package com.example.realestate.controller;

import com.example.realestate.exception.GameNotFoundException;
import com.example.realestate.exception.PlayerNotFoundException;
import com.example.realestate.model.dto.CreateGameRequest;
import com.example.realestate.model.dto.CreatePlayerRequest;
import com.example.realestate.model.dto.GameStateDTO;
import com.example.realestate.model.dto.MoveRequest;
import com.example.realestate.model.dto.PlayerStateDTO;
import com.example.realestate.service.GameService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/games")
public class GameController {

    private final GameService gameService;

    public GameController(GameService gameService) {
        this.gameService = gameService;
    }

    @PostMapping
    public ResponseEntity<GameStateDTO> createGame(@RequestBody(required = false) CreateGameRequest request) {
        CreateGameRequest body = request != null ? request : new CreateGameRequest();
        String gameId = gameService.createGame(body.getGoPayout(), body.getRents());
        return ResponseEntity.status(HttpStatus.CREATED).body(gameService.getGameState(gameId));
    }

    @GetMapping("/{gameId}")
    public ResponseEntity<GameStateDTO> getGame(@PathVariable String gameId) {
        return ResponseEntity.ok(gameService.getGameState(gameId));
    }

    @DeleteMapping("/{gameId}")
    public ResponseEntity<Void> deleteGame(@PathVariable String gameId) {
        gameService.removeGame(gameId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{gameId}/players")
    public ResponseEntity<?> createPlayer(@PathVariable String gameId, @RequestBody CreatePlayerRequest request) {
        boolean added = gameService.createPlayer(gameId, request.getName(), request.getStartingBalance());
        if (!added) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body("Name already in use: " + request.getName());
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(gameService.getGameState(gameId));
    }

    @GetMapping("/{gameId}/players/{name}")
    public ResponseEntity<PlayerStateDTO> getPlayer(@PathVariable String gameId, @PathVariable String name) {
        return ResponseEntity.ok(gameService.getPlayerState(gameId, name));
    }

    @PostMapping("/{gameId}/players/{name}/move")
    public ResponseEntity<GameStateDTO> movePlayer(@PathVariable String gameId, @PathVariable String name,
            @RequestBody MoveRequest request) {
        if (request.getSpaces() == null) {
            throw new IllegalArgumentException("Number of spaces to move is required");
        }
        gameService.movePlayer(gameId, name, request.getSpaces());
        return ResponseEntity.ok(gameService.getGameState(gameId));
    }

    @PostMapping("/{gameId}/players/{name}/buy")
    public ResponseEntity<Map<String, Boolean>> buySpace(@PathVariable String gameId, @PathVariable String name) {
        return ResponseEntity.ok(Map.of("purchased", gameService.buySpace(gameId, name)));
    }

    @GetMapping("/{gameId}/winner")
    public ResponseEntity<Map<String, String>> getWinner(@PathVariable String gameId) {
        return ResponseEntity.ok(Map.of("winner", gameService.checkGameOver(gameId)));
    }

    // --- Error mapping ---

    @ExceptionHandler({GameNotFoundException.class, PlayerNotFoundException.class})
    public ResponseEntity<String> handleNotFound(RuntimeException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<String> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(e.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<String> handleConflict(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(e.getMessage());
    }
}
