package com.myorg.esf.eventing.command;

import com.myorg.esf.eventstore.aggregate.EventSourcedAggregate;

import java.util.Optional;

/**
 * Return contract of a state-changing operation: the value for the caller, plus the aggregate
 * whose uncommitted events the post-command hook must persist and dispatch.
 */
public final class CommandResult<R> {

    private final R value;
    private final EventSourcedAggregate aggregate;
    private final String actorId;

    private CommandResult(R value, EventSourcedAggregate aggregate, String actorId) {
        this.value = value;
        this.aggregate = aggregate;
        this.actorId = actorId;
    }

    public static <R> CommandResult<R> of(R value, EventSourcedAggregate aggregate) {
        return new CommandResult<>(value, aggregate, null);
    }

    /** Result of an operation that changed nothing. */
    public static <R> CommandResult<R> valueOnly(R value) {
        return new CommandResult<>(value, null, null);
    }

    public CommandResult<R> actor(String actorId) {
        return new CommandResult<>(value, aggregate, actorId);
    }

    public R value() {
        return value;
    }

    public Optional<EventSourcedAggregate> aggregate() {
        return Optional.ofNullable(aggregate);
    }

    public String actorId() {
        return actorId;
    }
}
