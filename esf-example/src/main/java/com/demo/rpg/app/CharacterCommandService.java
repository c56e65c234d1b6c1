package com.demo.rpg.app;

import com.demo.rpg.domain.Character;
import com.myorg.esf.contracts.rpg.CharacterType;
import com.myorg.esf.eventing.command.CommandOutcome;
import com.myorg.esf.eventing.command.CommandResult;
import com.myorg.esf.eventing.command.EventSourcingCommandHook;
import com.myorg.esf.eventstore.EventSourcingRuntime;
import com.myorg.esf.eventstore.repository.EventSourcedAggregateRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Loads a character, runs one command on it and hands the result to the command hook, which
 * appends the raised events and dispatches them. A stale load surfaces as
 * {@link com.myorg.esf.contracts.core.exception.ConcurrencyConflictException}.
 */
@Slf4j
@Service
public class CharacterCommandService {

    private final EventSourcedAggregateRepository<Character> characters;
    private final EventSourcingCommandHook hook;
    private final Clock clock;

    public CharacterCommandService(EventSourcingRuntime runtime, EventSourcingCommandHook hook, Clock clock) {
        this.characters = runtime.repository(Character.DEFINITION);
        this.hook = hook;
        this.clock = clock;
    }

    public CharacterView create(String name, CharacterType type, String location, String actorId) {
        Character c = Character.create(UUID.randomUUID(), clock, name, type, location);
        CharacterView view = commit(c, actorId);
        log.info("Character created aggregateId={} name={} type={}", c.id(), view.name(), type);
        return view;
    }

    public CharacterView gainExperience(UUID id, int amount, String actorId) {
        return execute(id, actorId, c -> c.gainExperience(amount));
    }

    public CharacterView levelUp(UUID id, String actorId) {
        return execute(id, actorId, Character::levelUp);
    }

    public CharacterView takeDamage(UUID id, int damage, String actorId) {
        return execute(id, actorId, c -> c.takeDamage(damage));
    }

    public CharacterView heal(UUID id, int amount, String actorId) {
        return execute(id, actorId, c -> c.heal(amount));
    }

    public CharacterView moveTo(UUID id, String location, String actorId) {
        return execute(id, actorId, c -> c.moveTo(location));
    }

    private CharacterView execute(UUID id, String actorId, Consumer<Character> command) {
        Character c = characters.getById(id);
        command.accept(c);
        return commit(c, actorId);
    }

    private CharacterView commit(Character c, String actorId) {
        CommandOutcome<CharacterView> outcome = hook.afterCommand(CommandResult.of(CharacterView.of(c), c).actor(actorId));
        log.debug("Character aggregateId={} committed events={} head={}",
                c.id(), outcome.committedEvents(), outcome.headVersion());
        return outcome.value();
    }
}
