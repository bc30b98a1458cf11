package com.example.realestate.logic;

import com.example.realestate.exception.PlayerNotFoundException;
import com.example.realestate.model.domain.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;

/**
 * Pure Java class containing all game rules.
 * Not thread-safe: callers must confine a GameEngine to one thread or
 * synchronize on its {@link Game} externally.
 */
public class GameEngine {

    private static final Logger log = LoggerFactory.getLogger(GameEngine.class);

    private final Game game;

    public GameEngine() {
        this(new Game());
    }

    public GameEngine(Game game) {
        this.game = game;
    }

    public Game getGame() {
        return game;
    }

    public Board getBoard() {
        return game.getBoard();
    }

    public Collection<Player> getPlayers() {
        return game.getPlayers().values();
    }

    public List<TurnEvent> getHistory() {
        return game.getHistory();
    }

    // --- Setup ---

    public void createSpaces(int goPayout, List<Integer> rents) {
        if (game.getBoard() != null) {
            throw new IllegalStateException("Board has already been created");
        }
        game.setBoard(new Board(goPayout, rents));
        log.info("Game {}: board created with GO payout {}", game.getGameId(), goPayout);
    }

    /**
     * Registers a new player.
     *
     * @return false if the name is already taken; the existing player is left untouched
     */
    public boolean createPlayer(String name, int startingBalance) {
        if (startingBalance <= 0) {
            throw new IllegalArgumentException("Starting balance must be positive, got " + startingBalance);
        }
        if (game.hasPlayer(name)) {
            log.warn("Game {}: player {} was not added, name already in use", game.getGameId(), name);
            return false;
        }
        game.addPlayer(new Player(name, startingBalance));
        log.info("Game {}: player {} joined with balance {}", game.getGameId(), name, startingBalance);
        return true;
    }

    // --- Queries ---

    public Player getPlayer(String name) {
        return requirePlayer(name);
    }

    public int getAccountBalance(String name) {
        return requirePlayer(name).getAccountBalance();
    }

    public int getPosition(String name) {
        return requirePlayer(name).getPosition();
    }

    public List<Integer> getOwnedSpaces(String name) {
        return requirePlayer(name).getOwnedSpaces();
    }

    /**
     * @return the last player with a nonzero balance once every other player
     *         is eliminated, otherwise an empty string
     */
    public String checkGameOver() {
        int eliminated = 0;
        String winner = "";
        for (Player player : game.getPlayers().values()) {
            if (player.getAccountBalance() == 0) {
                eliminated++;
            } else {
                winner = player.getName();
            }
        }
        return eliminated == game.getPlayers().size() - 1 ? winner : "";
    }

    // --- Turn actions ---

    public boolean buySpace(String name) {
        Player player = requirePlayer(name);
        Space space = requireBoard().spaceAt(player.getPosition());

        if (!player.isActive() || space.isGo() || space.isOwned()
                || player.getAccountBalance() <= space.getPurchasePrice()) {
            return false;
        }

        player.withdraw(space.getPurchasePrice());
        player.addOwnedSpace(space.getIndex());
        space.setOwner(name);
        game.record(name, TurnEventType.PURCHASE, space.getIndex(), space.getPurchasePrice(), null);
        log.info("Game {}: {} bought space {} for {}", game.getGameId(), name, space.getIndex(),
                space.getPurchasePrice());
        return true;
    }

    public void movePlayer(String name, int spacesToMove) {
        if (spacesToMove < 0) {
            throw new IllegalArgumentException("Cannot move backwards: " + spacesToMove);
        }
        Player player = requirePlayer(name);
        Board board = requireBoard();
        if (!player.isActive()) {
            return;
        }

        advance(player, board, spacesToMove);
        payRent(player, board.spaceAt(player.getPosition()));
    }

    // --- Private Logic Methods ---

    private void advance(Player player, Board board, int spacesToMove) {
        long target = (long) player.getPosition() + spacesToMove;

        // Reaching the last index already counts as wrapping around
        if (target < board.size() - 1) {
            player.setPosition((int) target);
            game.record(player.getName(), TurnEventType.MOVE, (int) target, spacesToMove, null);
        } else {
            int wrapped = (int) (target % board.size());
            player.setPosition(wrapped);
            game.record(player.getName(), TurnEventType.MOVE, wrapped, spacesToMove, null);
            passGo(player, board);
        }
        log.debug("Game {}: {} moved {} to space {}", game.getGameId(), player.getName(), spacesToMove,
                player.getPosition());
    }

    private void passGo(Player player, Board board) {
        int payout = board.getGoPayout();
        player.deposit(payout);
        game.record(player.getName(), TurnEventType.PASS_GO, player.getPosition(), payout, null);
    }

    private void payRent(Player player, Space space) {
        String ownerName = space.getOwner();
        if (space.isGo() || ownerName == null || ownerName.equals(player.getName())) {
            return;
        }
        Player owner = requirePlayer(ownerName);
        int rent = space.getRent();
        int balance = player.getAccountBalance();

        if (rent < balance) {
            player.withdraw(rent);
            owner.deposit(rent);
            game.record(player.getName(), TurnEventType.RENT, space.getIndex(), rent, ownerName);
            log.debug("Game {}: {} paid {} rent to {}", game.getGameId(), player.getName(), rent, ownerName);
            return;
        }

        // Pays whatever is left and drops out
        player.withdraw(balance);
        owner.deposit(balance);
        game.record(player.getName(), TurnEventType.RENT, space.getIndex(), balance, ownerName);
        eliminate(player);
    }

    private void eliminate(Player player) {
        Board board = game.getBoard();
        for (Integer index : player.getOwnedSpaces()) {
            board.spaceAt(index).clearOwner();
        }
        player.clearOwnedSpaces();
        game.record(player.getName(), TurnEventType.ELIMINATION, player.getPosition(), 0, null);
        log.info("Game {}: {} has been eliminated", game.getGameId(), player.getName());
    }

    private Player requirePlayer(String name) {
        Player player = game.getPlayer(name);
        if (player == null) {
            throw new PlayerNotFoundException(name);
        }
        return player;
    }

    private Board requireBoard() {
        Board board = game.getBoard();
        if (board == null) {
            throw new IllegalStateException("Board has not been created");
        }
        return board;
    }
}
