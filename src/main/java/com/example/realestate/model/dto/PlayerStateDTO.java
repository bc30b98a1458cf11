package com.example.realestate.model.dto;

import com.example.realestate.model.domain.Player;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class PlayerStateDTO {
    private String name;
    private int accountBalance;
    private int position;
    private boolean active;
    private List<Integer> ownedSpaces;

    public static PlayerStateDTO from(Player player) {
        PlayerStateDTO dto = new PlayerStateDTO();
        dto.setName(player.getName());
        dto.setAccountBalance(player.getAccountBalance());
        dto.setPosition(player.getPosition());
        dto.setActive(player.isActive());
        dto.setOwnedSpaces(new ArrayList<>(player.getOwnedSpaces()));
        return dto;
    }
}
