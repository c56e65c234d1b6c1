package com.myorg.esf.eventing;

import java.lang.annotation.*;

/**
 * Marks a bean method as a handler for one event kind. Supported signatures:
 * {@code (Payload)} or {@code (DomainEvent, Payload)}.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface EsfEventHandler {
    /** Event kind tag, e.g. {@code RpgEventKinds.CHARACTER_LEVELED_UP_V1}. */
    String value();

    Class<?> payload();
}
