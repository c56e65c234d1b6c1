package com.myorg.esf.contracts.rpg;

public class RpgEventKinds {
    private RpgEventKinds() {}

    public static final String CHARACTER_AGGREGATE = "rpg.character";

    public static final String CHARACTER_CREATED_V1 = "rpg.character.created.v1";
    public static final String EXPERIENCE_GAINED_V1 = "rpg.character.experience-gained.v1";
    public static final String CHARACTER_LEVELED_UP_V1 = "rpg.character.leveled-up.v1";
    public static final String DAMAGE_TAKEN_V1 = "rpg.character.damage-taken.v1";
    public static final String CHARACTER_HEALED_V1 = "rpg.character.healed.v1";
    public static final String CHARACTER_DIED_V1 = "rpg.character.died.v1";
    public static final String LOCATION_CHANGED_V1 = "rpg.character.location-changed.v1";
}
