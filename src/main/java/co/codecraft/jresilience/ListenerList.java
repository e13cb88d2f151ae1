package co.codecraft.jresilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The listeners registered with one component instance.
 */
public class ListenerList<E> {

    private static final Logger log = LoggerFactory.getLogger(ListenerList.class);

    private final String owner;
    private final CopyOnWriteArrayList<ResilienceListener<E>> listeners =
            new CopyOnWriteArrayList<ResilienceListener<E>>();

    /**
     * @param owner  Name of the owning component; used in log messages.
     */
    public ListenerList(String owner) {
        this.owner = owner;
    }

    public void add(ResilienceListener<E> listener) {
        if (listener == null) {
            throw new IllegalArgumentException("Listener cannot be null.");
        }
        listeners.addIfAbsent(listener);
    }

    public boolean remove(ResilienceListener<E> listener) {
        return listeners.remove(listener);
    }

    public void clear() {
        listeners.clear();
    }

    public int size() {
        return listeners.size();
    }

    public void fire(E event) {
        for (ResilienceListener<E> listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Listener of {} threw while handling {}", owner, event, e);
            }
        }
    }
}
