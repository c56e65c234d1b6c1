package com.demo.rpg.web;

import com.demo.rpg.app.CharacterEventHandlers;
import com.demo.rpg.domain.Character;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.esf.contracts.core.exception.ConcurrencyConflictException;
import com.myorg.esf.eventing.command.CommandResult;
import com.myorg.esf.eventing.command.EventSourcingCommandHook;
import com.myorg.esf.eventstore.EventSourcingRuntime;
import com.myorg.esf.eventstore.repository.EventSourcedAggregateRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class CharacterApiTest {

    @Autowired MockMvc mvc;
    @Autowired ObjectMapper mapper;
    @Autowired EventSourcingRuntime runtime;
    @Autowired EventSourcingCommandHook hook;
    @Autowired MeterRegistry meterRegistry;

    @Test
    void characterLifecycle_isPersistedAsEvents() throws Exception {
        UUID id = create("Conan", "WARRIOR");
        double leveledBefore = meterRegistry.counter(CharacterEventHandlers.LEVELED_UP).count();

        mvc.perform(post("/characters/{id}/experience", id).contentType(MediaType.APPLICATION_JSON)
                        .header(CharacterController.ACTOR_HEADER, "gm-1")
                        .content("{\"amount\":250}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.level").value(2))
                .andExpect(jsonPath("$.experience").value(150));

        mvc.perform(post("/characters/{id}/damage", id).contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":31}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.health").value(140));

        mvc.perform(post("/characters/{id}/heal", id).contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":5}"))
                .andExpect(jsonPath("$.health").value(145));

        mvc.perform(post("/characters/{id}/move", id).contentType(MediaType.APPLICATION_JSON)
                        .content("{\"location\":\"Dark Forest\"}"))
                .andExpect(jsonPath("$.location").value("Dark Forest"));

        mvc.perform(get("/characters/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.version").value(6))
                .andExpect(jsonPath("$.maxHealth").value(160))
                .andExpect(jsonPath("$.location").value("Dark Forest"));

        mvc.perform(get("/characters/{id}/events", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(6))
                .andExpect(jsonPath("$[0].eventKind").value("rpg.character.created.v1"))
                .andExpect(jsonPath("$[1].actorId").value("gm-1"))
                .andExpect(jsonPath("$[2].payload.newLevel").value(2));

        assertEquals(leveledBefore + 1, meterRegistry.counter(CharacterEventHandlers.LEVELED_UP).count());
    }

    @Test
    void forcedSnapshot_showsInStatistics() throws Exception {
        UUID id = create("Merlin", "MAGE");
        mvc.perform(post("/characters/{id}/level-up", id)).andExpect(status().isOk());

        mvc.perform(post("/characters/{id}/snapshots", id))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.version").value(2));

        mvc.perform(post("/characters/{id}/heal", id).contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\":1}"));

        mvc.perform(get("/characters/{id}/snapshots/stats", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalEvents").value(3))
                .andExpect(jsonPath("$.totalSnapshots").value(1))
                .andExpect(jsonPath("$.latestSnapshotVersion").value(2))
                .andExpect(jsonPath("$.eventsSinceLastSnapshot").value(1));

        mvc.perform(get("/characters/{id}", id))
                .andExpect(jsonPath("$.level").value(2))
                .andExpect(jsonPath("$.version").value(3));
    }

    @Test
    void errors_areMappedToHttpStatuses() throws Exception {
        mvc.perform(get("/characters/{id}", UUID.randomUUID()))
                .andExpect(status().isNotFound());
        mvc.perform(get("/characters/{id}/events", UUID.randomUUID()))
                .andExpect(status().isNotFound());

        UUID id = create("Robin", "ROGUE");
        mvc.perform(post("/characters/{id}/damage", id).contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":-5}"))
                .andExpect(status().isBadRequest());

        mvc.perform(post("/characters/{id}/damage", id).contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":1000}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.alive").value(false));
        mvc.perform(post("/characters/{id}/heal", id).contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":5}"))
                .andExpect(status().isUnprocessableEntity());
    }

    @Test
    void staleCopy_isRejectedWithConflict() throws Exception {
        UUID id = create("Legolas", "ARCHER");
        EventSourcedAggregateRepository<Character> repository = runtime.repository(Character.DEFINITION);

        Character first = repository.getById(id);
        Character second = repository.getById(id);
        first.takeDamage(20);
        second.heal(1);
        hook.afterCommand(CommandResult.of(null, first));

        assertThatThrownBy(() -> hook.afterCommand(CommandResult.of(null, second)))
                .isInstanceOf(ConcurrencyConflictException.class);
        assertEquals(2, runtime.eventStore().headVersion(id));
    }

    private UUID create(String name, String type) throws Exception {
        MvcResult result = mvc.perform(post("/characters").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"" + name + "\",\"type\":\"" + type + "\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.level").value(1))
                .andReturn();
        JsonNode body = mapper.readTree(result.getResponse().getContentAsString());
        return UUID.fromString(body.get("id").asText());
    }
}
