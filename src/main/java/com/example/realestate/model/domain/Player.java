package com.example.realestate.model.domain;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * Account state of one player. Balance checks are the engine's job; this
 * class only does the arithmetic.
 */
@Getter
public class Player {

    private final String name;
    private int accountBalance;
    private int position = 0;
    private final List<Integer> ownedSpaces = new ArrayList<>();

    public Player(String name, int startingBalance) {
        this.name = name;
        this.accountBalance = startingBalance;
    }

    public boolean isActive() {
        return accountBalance > 0;
    }

    public void deposit(int amount) {
        this.accountBalance += amount;
    }

    public void withdraw(int amount) {
        this.accountBalance -= amount;
    }

    public void setPosition(int position) {
        this.position = position;
    }

    public void addOwnedSpace(int spaceIndex) {
        ownedSpaces.add(spaceIndex);
    }

    /**
     * @return a snapshot; later purchases or an elimination do not show up in it
     */
    public List<Integer> getOwnedSpaces() {
        return List.copyOf(ownedSpaces);
    }

    public void clearOwnedSpaces() {
        ownedSpaces.clear();
    }
}
