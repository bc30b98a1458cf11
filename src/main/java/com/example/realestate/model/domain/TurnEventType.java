package com.example.realestate.model.domain;

public enum TurnEventType {
    MOVE,        // position changed
    PASS_GO,     // GO payout credited
    PURCHASE,    // space bought
    RENT,        // rent paid to an owner
    ELIMINATION  // balance reached zero, spaces released
}
