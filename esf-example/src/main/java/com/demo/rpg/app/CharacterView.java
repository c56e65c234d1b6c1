package com.demo.rpg.app;

import com.demo.rpg.domain.Character;
import com.myorg.esf.contracts.rpg.CharacterType;

import java.util.UUID;

public record CharacterView(
        UUID id,
        long version,
        String name,
        CharacterType characterType,
        int level,
        int experience,
        int experienceToNextLevel,
        int health,
        int maxHealth,
        int strength,
        int defense,
        String location,
        boolean alive
) {
    public static CharacterView of(Character c) {
        return new CharacterView(c.id(), c.version(), c.getName(), c.getCharacterType(), c.getLevel(),
                c.getExperience(), c.getExperienceToNextLevel(), c.getHealth(), c.getMaxHealth(),
                c.getStrength(), c.getDefense(), c.getLocation(), c.isAlive());
    }
}
