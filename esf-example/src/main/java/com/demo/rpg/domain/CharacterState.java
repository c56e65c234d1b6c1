package com.demo.rpg.domain;

import com.myorg.esf.contracts.rpg.CharacterType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Snapshot shape of a {@link Character}. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CharacterState {
    private String name;
    private CharacterType characterType;
    private int level;
    private int experience;
    private int health;
    private int maxHealth;
    private int strength;
    private int defense;
    private String location;
}
