package com.example.realestate.model.domain;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Getter
public class Board {

    public static final int SIZE = 25;
    public static final int RENT_COUNT = SIZE - 1;

    private final List<Space> spaces;

    public Board(int goPayout, List<Integer> rents) {
        if (rents == null || rents.size() != RENT_COUNT) {
            throw new IllegalArgumentException("Exactly " + RENT_COUNT + " rents are required, got "
                    + (rents == null ? "none" : rents.size()));
        }
        if (goPayout < 0) {
            throw new IllegalArgumentException("GO payout must not be negative");
        }

        List<Space> built = new ArrayList<>(SIZE);
        built.add(new Space(0, goPayout));
        for (int i = 1; i < SIZE; i++) {
            Integer rent = rents.get(i - 1);
            if (rent == null || rent < 0) {
                throw new IllegalArgumentException("Invalid rent for space " + i + ": " + rent);
            }
            built.add(new Space(i, rent));
        }
        this.spaces = Collections.unmodifiableList(built);
    }

    public Space spaceAt(int index) {
        if (index < 0 || index >= SIZE) {
            throw new IllegalArgumentException("No space at index " + index);
        }
        return spaces.get(index);
    }

    public int size() {
        return spaces.size();
    }

    public int getGoPayout() {
        return spaces.get(0).getRent();
    }
}
