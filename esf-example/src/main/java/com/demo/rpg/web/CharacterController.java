package com.demo.rpg.web;

import com.demo.rpg.app.CharacterCommandService;
import com.demo.rpg.app.CharacterQueryService;
import com.demo.rpg.app.CharacterView;
import com.myorg.esf.contracts.rpg.CharacterType;
import com.myorg.esf.eventstore.snapshot.SnapshotStatistics;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/characters")
@RequiredArgsConstructor
public class CharacterController {

    public static final String ACTOR_HEADER = "X-Actor-Id";

    private final CharacterCommandService commands;
    private final CharacterQueryService queries;

    public record CreateCharacterRequest(String name, CharacterType type, String location) {}
    public record AmountRequest(int amount) {}
    public record MoveRequest(String location) {}

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public CharacterView create(@RequestBody CreateCharacterRequest req,
                                @RequestHeader(name = ACTOR_HEADER, required = false) String actor) {
        return commands.create(req.name(), req.type(), req.location(), actor);
    }

    @PostMapping("/{id}/experience")
    public CharacterView experience(@PathVariable UUID id, @RequestBody AmountRequest req,
                                    @RequestHeader(name = ACTOR_HEADER, required = false) String actor) {
        return commands.gainExperience(id, req.amount(), actor);
    }

    @PostMapping("/{id}/level-up")
    public CharacterView levelUp(@PathVariable UUID id,
                                 @RequestHeader(name = ACTOR_HEADER, required = false) String actor) {
        return commands.levelUp(id, actor);
    }

    @PostMapping("/{id}/damage")
    public CharacterView damage(@PathVariable UUID id, @RequestBody AmountRequest req,
                                @RequestHeader(name = ACTOR_HEADER, required = false) String actor) {
        return commands.takeDamage(id, req.amount(), actor);
    }

    @PostMapping("/{id}/heal")
    public CharacterView heal(@PathVariable UUID id, @RequestBody AmountRequest req,
                              @RequestHeader(name = ACTOR_HEADER, required = false) String actor) {
        return commands.heal(id, req.amount(), actor);
    }

    @PostMapping("/{id}/move")
    public CharacterView move(@PathVariable UUID id, @RequestBody MoveRequest req,
                              @RequestHeader(name = ACTOR_HEADER, required = false) String actor) {
        return commands.moveTo(id, req.location(), actor);
    }

    @GetMapping("/{id}")
    public CharacterView get(@PathVariable UUID id) {
        return queries.get(id);
    }

    @GetMapping("/{id}/events")
    public List<CharacterQueryService.EventView> events(@PathVariable UUID id,
                                                        @RequestParam(name = "fromVersion", defaultValue = "1") long fromVersion) {
        return queries.events(id, fromVersion);
    }

    @GetMapping("/{id}/snapshots/stats")
    public SnapshotStatistics snapshotStats(@PathVariable UUID id) {
        return queries.snapshotStatistics(id);
    }

    @PostMapping("/{id}/snapshots")
    @ResponseStatus(HttpStatus.CREATED)
    public CharacterQueryService.SnapshotView createSnapshot(@PathVariable UUID id) {
        return queries.createSnapshot(id);
    }
}
