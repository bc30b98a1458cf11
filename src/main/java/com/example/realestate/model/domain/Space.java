package com.example.realestate.model.domain;

import lombok.Getter;

/**
 * A single space on the board. Index 0 is GO, whose rent field holds the
 * amount paid out for passing or landing on it.
 */
@Getter
public class Space {

    public static final String GO_NAME = "GO";
    public static final int PRICE_MULTIPLIER = 5;

    private final int index;
    private final String name;
    private final int rent;
    private final int purchasePrice;
    private String owner; // player name, or null while unowned

    public Space(int index, int rent) {
        this.index = index;
        this.name = index == 0 ? GO_NAME : String.valueOf(index);
        this.rent = rent;
        this.purchasePrice = rent * PRICE_MULTIPLIER;
    }

    public boolean isGo() {
        return index == 0;
    }

    public boolean isOwned() {
        return owner != null;
    }

    public void setOwner(String playerName) {
        if (isGo()) {
            throw new IllegalStateException("GO cannot be owned");
        }
        this.owner = playerName;
    }

    public void clearOwner() {
        this.owner = null;
    }
}
