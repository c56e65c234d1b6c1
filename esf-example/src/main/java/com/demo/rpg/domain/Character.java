package com.demo.rpg.domain;

import com.myorg.esf.contracts.rpg.CharacterType;
import com.myorg.esf.contracts.rpg.RpgEventKinds;
import com.myorg.esf.contracts.rpg.events.CharacterCreated;
import com.myorg.esf.contracts.rpg.events.CharacterDied;
import com.myorg.esf.contracts.rpg.events.CharacterHealed;
import com.myorg.esf.contracts.rpg.events.CharacterLeveledUp;
import com.myorg.esf.contracts.rpg.events.DamageTaken;
import com.myorg.esf.contracts.rpg.events.ExperienceGained;
import com.myorg.esf.contracts.rpg.events.LocationChanged;
import com.myorg.esf.eventstore.aggregate.AggregateDefinition;
import com.myorg.esf.eventstore.aggregate.AggregateEvents;
import com.myorg.esf.eventstore.aggregate.EventSourcedAggregate;
import com.myorg.esf.eventstore.aggregate.Tiered;

import java.time.Clock;
import java.util.UUID;

/**
 * Player character. Commands validate, then raise events; state only changes in the appliers
 * registered on {@link #DEFINITION}, so replaying the events rebuilds the same character.
 *
 * <p>Rules: damage is reduced by defense but always at least 1, health never drops below 0 and
 * reaching 0 kills the character. Each level up grants +10 max health with a full heal, +2
 * strength and +1 defense. Reaching a level needs {@code 100 * level} experience, which is
 * consumed by the level up.
 */
public class Character implements EventSourcedAggregate, Tiered {

    public static final int BASE_EXPERIENCE_PER_LEVEL = 100;
    public static final int MAX_EXPERIENCE_PER_GAIN = 1_000_000;
    public static final int HEALTH_PER_LEVEL = 10;
    public static final int STRENGTH_PER_LEVEL = 2;
    public static final int DEFENSE_PER_LEVEL = 1;

    public static final AggregateDefinition<Character> DEFINITION = AggregateDefinition
            .builder(RpgEventKinds.CHARACTER_AGGREGATE, Character::new)
            .on(RpgEventKinds.CHARACTER_CREATED_V1, CharacterCreated.class, Character::whenCreated)
            .on(RpgEventKinds.EXPERIENCE_GAINED_V1, ExperienceGained.class, Character::whenExperienceGained)
            .on(RpgEventKinds.CHARACTER_LEVELED_UP_V1, CharacterLeveledUp.class, Character::whenLeveledUp)
            .on(RpgEventKinds.DAMAGE_TAKEN_V1, DamageTaken.class, Character::whenDamageTaken)
            .on(RpgEventKinds.CHARACTER_HEALED_V1, CharacterHealed.class, Character::whenHealed)
            .on(RpgEventKinds.CHARACTER_DIED_V1, CharacterDied.class, Character::whenDied)
            .on(RpgEventKinds.LOCATION_CHANGED_V1, LocationChanged.class, Character::whenLocationChanged)
            .snapshots(CharacterState.class, Character::toState, Character::fromState)
            .build();

    private final AggregateEvents events;

    private String name;
    private CharacterType characterType;
    private int level;
    private int experience;
    private int health;
    private int maxHealth;
    private int strength;
    private int defense;
    private String location;

    Character(UUID id, Clock clock) {
        this.events = new AggregateEvents(id, clock);
    }

    public static Character create(UUID id, Clock clock, String name, CharacterType type, String location) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Character name cannot be empty");
        }
        if (type == null) {
            throw new IllegalArgumentException("Character type is required");
        }
        ClassStats stats = ClassStats.of(type);
        Character c = new Character(id, clock);
        c.raise(RpgEventKinds.CHARACTER_CREATED_V1, CharacterCreated.builder()
                .name(name.trim())
                .characterType(type)
                .maxHealth(stats.health())
                .strength(stats.strength())
                .defense(stats.defense())
                .location(location == null || location.isBlank() ? ClassStats.START_LOCATION : location.trim())
                .build());
        return c;
    }

    // --- commands ---

    public void gainExperience(int amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Experience amount cannot be negative");
        }
        if (amount > MAX_EXPERIENCE_PER_GAIN) {
            throw new IllegalArgumentException("Experience amount cannot exceed " + MAX_EXPERIENCE_PER_GAIN);
        }
        requireAlive("gain experience");

        long total = (long) experience + amount;
        int lvl = level;
        int levelsGained = 0;
        while (total >= (long) BASE_EXPERIENCE_PER_LEVEL * lvl) {
            total -= (long) BASE_EXPERIENCE_PER_LEVEL * lvl;
            lvl++;
            levelsGained++;
        }
        raise(RpgEventKinds.EXPERIENCE_GAINED_V1, ExperienceGained.builder()
                .experienceGained(amount)
                .totalExperience((int) total)
                .experienceToNextLevel(BASE_EXPERIENCE_PER_LEVEL * lvl)
                .build());
        for (int i = 0; i < levelsGained; i++) {
            raiseLevelUp();
        }
    }

    /** Grants one level without consuming experience. */
    public void levelUp() {
        requireAlive("level up");
        raiseLevelUp();
    }

    public void takeDamage(int damage) {
        if (damage < 0) {
            throw new IllegalArgumentException("Damage cannot be negative");
        }
        requireAlive("take damage");

        int actual = Math.max(1, damage - defense);
        int remaining = Math.max(0, health - actual);
        raise(RpgEventKinds.DAMAGE_TAKEN_V1, new DamageTaken(actual, remaining));
        if (remaining == 0) {
            raise(RpgEventKinds.CHARACTER_DIED_V1, new CharacterDied(level, location));
        }
    }

    public void heal(int amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Heal amount cannot be negative");
        }
        requireAlive("be healed");

        int after = Math.min(maxHealth, health + amount);
        raise(RpgEventKinds.CHARACTER_HEALED_V1, new CharacterHealed(after - health, after));
    }

    public void moveTo(String newLocation) {
        if (newLocation == null || newLocation.isBlank()) {
            throw new IllegalArgumentException("Location cannot be empty");
        }
        requireAlive("move");
        String target = newLocation.trim();
        if (target.equals(location)) {
            return;
        }
        raise(RpgEventKinds.LOCATION_CHANGED_V1, new LocationChanged(location, target));
    }

    // --- appliers ---

    private void whenCreated(CharacterCreated e) {
        name = e.getName();
        characterType = e.getCharacterType();
        level = 1;
        experience = 0;
        maxHealth = e.getMaxHealth();
        health = e.getMaxHealth();
        strength = e.getStrength();
        defense = e.getDefense();
        location = e.getLocation();
    }

    private void whenExperienceGained(ExperienceGained e) {
        experience = e.getTotalExperience();
    }

    private void whenLeveledUp(CharacterLeveledUp e) {
        level = e.getNewLevel();
        maxHealth += e.getHealthIncrease();
        health = maxHealth;
        strength += e.getStrengthIncrease();
        defense += e.getDefenseIncrease();
    }

    private void whenDamageTaken(DamageTaken e) {
        health = e.getRemainingHealth();
    }

    private void whenHealed(CharacterHealed e) {
        health = e.getHealth();
    }

    private void whenDied(CharacterDied e) {
        health = 0;
    }

    private void whenLocationChanged(LocationChanged e) {
        location = e.getNewLocation();
    }

    // --- snapshots ---

    private CharacterState toState() {
        return CharacterState.builder()
                .name(name)
                .characterType(characterType)
                .level(level)
                .experience(experience)
                .health(health)
                .maxHealth(maxHealth)
                .strength(strength)
                .defense(defense)
                .location(location)
                .build();
    }

    private static Character fromState(UUID id, Clock clock, CharacterState s) {
        Character c = new Character(id, clock);
        c.name = s.getName();
        c.characterType = s.getCharacterType();
        c.level = s.getLevel();
        c.experience = s.getExperience();
        c.health = s.getHealth();
        c.maxHealth = s.getMaxHealth();
        c.strength = s.getStrength();
        c.defense = s.getDefense();
        c.location = s.getLocation();
        return c;
    }

    private void raiseLevelUp() {
        raise(RpgEventKinds.CHARACTER_LEVELED_UP_V1, CharacterLeveledUp.builder()
                .oldLevel(level)
                .newLevel(level + 1)
                .healthIncrease(HEALTH_PER_LEVEL)
                .strengthIncrease(STRENGTH_PER_LEVEL)
                .defenseIncrease(DEFENSE_PER_LEVEL)
                .build());
    }

    private void raise(String eventKind, Object payload) {
        DEFINITION.mutate(this, events.record(eventKind, payload));
    }

    private void requireAlive(String action) {
        if (!isAlive()) {
            throw new IllegalStateException("Character " + id() + " is defeated and cannot " + action);
        }
    }

    @Override
    public AggregateEvents events() {
        return events;
    }

    @Override
    public String aggregateKind() {
        return RpgEventKinds.CHARACTER_AGGREGATE;
    }

    @Override
    public int tier() {
        return level;
    }

    public String getName() { return name; }
    public CharacterType getCharacterType() { return characterType; }
    public int getLevel() { return level; }
    public int getExperience() { return experience; }
    public int getExperienceToNextLevel() { return BASE_EXPERIENCE_PER_LEVEL * level; }
    public int getHealth() { return health; }
    public int getMaxHealth() { return maxHealth; }
    public int getStrength() { return strength; }
    public int getDefense() { return defense; }
    public String getLocation() { return location; }
    public boolean isAlive() { return health > 0; }
}
