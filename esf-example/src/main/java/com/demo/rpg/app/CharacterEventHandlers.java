package com.demo.rpg.app;

import com.myorg.esf.contracts.core.event.DomainEvent;
import com.myorg.esf.contracts.rpg.RpgEventKinds;
import com.myorg.esf.contracts.rpg.events.CharacterCreated;
import com.myorg.esf.contracts.rpg.events.CharacterDied;
import com.myorg.esf.contracts.rpg.events.CharacterLeveledUp;
import com.myorg.esf.eventing.EsfEventHandler;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class CharacterEventHandlers {

    public static final String CREATED = "rpg.characters.created";
    public static final String LEVELED_UP = "rpg.characters.leveled_up";
    public static final String DIED = "rpg.characters.died";

    private final MeterRegistry meterRegistry;

    @PostConstruct
    void initMetrics() {
        meterRegistry.counter(CREATED);
        meterRegistry.counter(LEVELED_UP);
        meterRegistry.counter(DIED);
    }

    @EsfEventHandler(value = RpgEventKinds.CHARACTER_CREATED_V1, payload = CharacterCreated.class)
    public void onCreated(CharacterCreated payload) {
        meterRegistry.counter(CREATED).increment();
    }

    @EsfEventHandler(value = RpgEventKinds.CHARACTER_LEVELED_UP_V1, payload = CharacterLeveledUp.class)
    public void onLeveledUp(DomainEvent event, CharacterLeveledUp payload) {
        log.info("Character leveled up aggregateId={} {} -> {}",
                event.getAggregateId(), payload.getOldLevel(), payload.getNewLevel());
        meterRegistry.counter(LEVELED_UP).increment();
    }

    @EsfEventHandler(value = RpgEventKinds.CHARACTER_DIED_V1, payload = CharacterDied.class)
    public void onDied(DomainEvent event, CharacterDied payload) {
        log.warn("Character defeated aggregateId={} level={} location={}",
                event.getAggregateId(), payload.getLevel(), payload.getLocation());
        meterRegistry.counter(DIED).increment();
    }
}
