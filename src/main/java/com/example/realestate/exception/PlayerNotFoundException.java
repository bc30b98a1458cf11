package com.example.realestate.exception;

public class PlayerNotFoundException extends RuntimeException {

    public PlayerNotFoundException(String playerName) {
        super("Player not found: " + playerName);
    }
}
