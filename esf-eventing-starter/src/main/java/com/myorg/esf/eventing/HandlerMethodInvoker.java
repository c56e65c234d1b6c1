package com.myorg.esf.eventing;

import com.myorg.esf.contracts.core.event.DomainEvent;
import lombok.Data;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;

/**
 * Adapts an {@link EsfEventHandler} method to {@link EventHandler}.
 */
@Data
public class HandlerMethodInvoker implements EventHandler {
    private final Object target;
    private final Method method;
    private final Class<?> payloadClass;

    public HandlerMethodInvoker(Object target, Method method, Class<?> payloadClass) {
        int params = method.getParameterCount();
        if (params == 2 && !DomainEvent.class.isAssignableFrom(method.getParameterTypes()[0])) {
            throw new IllegalStateException("Two-argument handler must take (DomainEvent, payload): " + method);
        }
        if (params != 1 && params != 2) {
            throw new IllegalStateException("Handler method must have 1 or 2 params: (payload) or (event, payload): " + method);
        }
        this.target = target;
        this.method = method;
        this.payloadClass = payloadClass;
    }

    @Override
    public void handle(DomainEvent event) throws Exception {
        Object payload = event.payloadAs(payloadClass);
        try {
            if (method.getParameterCount() == 1) {
                method.invoke(target, payload);
            } else {
                method.invoke(target, event, payload);
            }
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) throw ex;
            if (cause instanceof Error err) throw err;
            throw e;
        }
    }
}
