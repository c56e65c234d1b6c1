package com.myorg.esf.contracts.rpg.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class CharacterLeveledUp {
    private int oldLevel;
    private int newLevel;
    private int healthIncrease;
    private int strengthIncrease;
    private int defenseIncrease;
}
