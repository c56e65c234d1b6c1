package com.myorg.esf.contracts.rpg;

public enum CharacterType {
    WARRIOR,
    MAGE,
    ROGUE,
    ARCHER
}
