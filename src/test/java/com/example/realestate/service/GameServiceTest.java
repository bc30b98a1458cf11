package com.example.realestate.service;

import com.example.realestate.exception.GameNotFoundException;
import com.example.realestate.exception.PlayerNotFoundException;
import com.example.realestate.model.domain.TurnEventType;
import com.example.realestate.model.dto.GameStateDTO;
import com.example.realestate.model.dto.PlayerStateDTO;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class GameServiceTest {

    private GameService gameService;

    @BeforeEach
    void setUp() {
        gameService = new GameService();
        // Manually inject values using ReflectionTestUtils
        ReflectionTestUtils.setField(gameService, "defaultGoPayout", 200);
        ReflectionTestUtils.setField(gameService, "defaultRent", 50);
        ReflectionTestUtils.setField(gameService, "defaultStartingBalance", 1000);
    }

    @Test
    void testFullGameFlow() {
        String gameId = gameService.createGame(null, null);

        assertTrue(gameService.createPlayer(gameId, "A", null));
        assertTrue(gameService.createPlayer(gameId, "B", 30));
        assertFalse(gameService.createPlayer(gameId, "A", 5));

        gameService.movePlayer(gameId, "A", 1);
        assertTrue(gameService.buySpace(gameId, "A"));
        gameService.movePlayer(gameId, "B", 1);

        GameStateDTO state = gameService.getGameState(gameId);
        assertEquals(25, state.getSpaces().size());
        assertEquals("A", state.getSpaces().get(1).getOwner());
        assertEquals(250, state.getSpaces().get(1).getPurchasePrice());
        assertEquals(0, state.getSpaces().get(0).getPurchasePrice());
        assertEquals("A", state.getWinner());
        assertEquals(TurnEventType.ELIMINATION, state.getHistory().get(state.getHistory().size() - 1).getType());

        PlayerStateDTO a = gameService.getPlayerState(gameId, "A");
        assertEquals(780, a.getAccountBalance());
        assertEquals(List.of(1), a.getOwnedSpaces());

        PlayerStateDTO b = gameService.getPlayerState(gameId, "B");
        assertFalse(b.isActive());
        assertEquals("A", gameService.checkGameOver(gameId));
    }

    @Test
    void testExplicitBoard() {
        String gameId = gameService.createGame(500, Collections.nCopies(24, 10));
        gameService.createPlayer(gameId, "A", 100);
        gameService.movePlayer(gameId, "A", 24);

        PlayerStateDTO a = gameService.getPlayerState(gameId, "A");
        assertEquals(600, a.getAccountBalance());
        assertEquals(24, a.getPosition());
    }

    @Test
    void testUnknownGameAndPlayer() {
        assertThrows(GameNotFoundException.class, () -> gameService.getGameState("missing"));
        assertThrows(GameNotFoundException.class, () -> gameService.removeGame("missing"));

        String gameId = gameService.createGame(null, null);
        assertThrows(PlayerNotFoundException.class, () -> gameService.getPlayerState(gameId, "ghost"));
        assertThrows(IllegalArgumentException.class, () -> gameService.createPlayer(gameId, " ", 100));
        assertThrows(IllegalArgumentException.class, () -> gameService.createPlayer(gameId, "Debtor", -5));

        gameService.removeGame(gameId);
        assertThrows(GameNotFoundException.class, () -> gameService.movePlayer(gameId, "A", 1));
    }

    @Test
    void testConcurrentMovesAreSerialized() throws InterruptedException {
        String gameId = gameService.createGame(null, null);
        gameService.createPlayer(gameId, "A", 1000);

        ExecutorService pool = Executors.newFixedThreadPool(4);
        for (int i = 0; i < 100; i++) {
            pool.submit(() -> gameService.movePlayer(gameId, "A", 25));
        }
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        // Each full lap lands back on GO and pays 200
        PlayerStateDTO a = gameService.getPlayerState(gameId, "A");
        assertEquals(0, a.getPosition());
        assertEquals(1000 + 100 * 200, a.getAccountBalance());
    }
}
