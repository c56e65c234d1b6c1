package com.myorg.esf.contracts.rpg.events;

import com.myorg.esf.contracts.rpg.CharacterType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class CharacterCreated {
    private String name;
    private CharacterType characterType;
    private int maxHealth;
    private int strength;
    private int defense;
    private String location;
}
