package com.example.realestate.model.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlayerTest {

    @Test
    void testNewPlayerStartsOnGo() {
        Player player = new Player("A", 500);
        assertEquals("A", player.getName());
        assertEquals(500, player.getAccountBalance());
        assertEquals(0, player.getPosition());
        assertTrue(player.getOwnedSpaces().isEmpty());
        assertTrue(player.isActive());
    }

    @Test
    void testBalanceArithmetic() {
        Player player = new Player("A", 100);
        player.deposit(40);
        player.withdraw(140);
        assertEquals(0, player.getAccountBalance());
        assertFalse(player.isActive());
    }

    @Test
    void testOwnedSpacesKeepOrder() {
        Player player = new Player("A", 100);
        player.addOwnedSpace(9);
        player.addOwnedSpace(2);
        assertEquals(List.of(9, 2), player.getOwnedSpaces());
        assertThrows(UnsupportedOperationException.class, () -> player.getOwnedSpaces().add(3));

        player.clearOwnedSpaces();
        assertTrue(player.getOwnedSpaces().isEmpty());
    }
}
