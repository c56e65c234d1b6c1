package com.demo.rpg.domain;

import com.myorg.esf.contracts.rpg.CharacterType;

/** Starting stats per character class. */
record ClassStats(int health, int strength, int defense) {

    static final String START_LOCATION = "Town Square";

    static ClassStats of(CharacterType type) {
        return switch (type) {
            case WARRIOR -> new ClassStats(150, 20, 10);
            case MAGE -> new ClassStats(100, 10, 5);
            case ROGUE -> new ClassStats(120, 15, 8);
            case ARCHER -> new ClassStats(110, 14, 6);
        };
    }
}
