package com.example.realestate.model.dto;

import com.example.realestate.model.domain.Space;
import lombok.Data;

@Data
public class SpaceStateDTO {
    private int index;
    private String name;
    private int rent;
    private int purchasePrice;
    private String owner;

    public static SpaceStateDTO from(Space space) {
        SpaceStateDTO dto = new SpaceStateDTO();
        dto.setIndex(space.getIndex());
        dto.setName(space.getName());
        dto.setRent(space.getRent());
        dto.setPurchasePrice(space.isGo() ? 0 : space.getPurchasePrice());
        dto.setOwner(space.getOwner());
        return dto;
    }
}
