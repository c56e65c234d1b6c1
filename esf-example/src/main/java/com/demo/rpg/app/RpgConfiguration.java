package com.demo.rpg.app;

import com.demo.rpg.domain.Character;
import com.myorg.esf.eventstore.aggregate.AggregateDefinition;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RpgConfiguration {

    /** Picked up by the event store starter, which binds a repository and snapshot service to it. */
    @Bean
    public AggregateDefinition<Character> characterDefinition() {
        return Character.DEFINITION;
    }
}
