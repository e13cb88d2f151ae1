package co.codecraft.jresilience;

/**
 * Receive events from a breaker, bulkhead or recovery instance. Events are delivered on whatever thread caused
 * them, possibly concurrently. Processing should be very fast and light, to avoid bogging down the component.
 * An exception thrown by a listener is logged and otherwise ignored.
 *
 * @param <E>  The component's event type.
 */
public interface ResilienceListener<E> {
    void onEvent(E event);
}
