package co.codecraft.jresilience.breaker;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * <p>The state cell of a {@link CircuitBreaker}: a simple state machine plus the ability to notify a listener
 * about transitions. Circuits are never used directly by callers; the breaker that owns one is the public
 * interface.</p>
 *
 * <h3><a name="statemachine">State Machine</a></h3>
 * <pre>
 *    {@link #CLOSED} --success--&gt; {@link #CLOSED}
 *    {@link #CLOSED} --failureThreshold consecutive failures--&gt; {@link #OPEN}
 *    {@link #OPEN} --call after resetTimeout--&gt; {@link #HALF_OPEN}
 *    {@link #HALF_OPEN} --success--&gt; {@link #CLOSED}
 *    {@link #HALF_OPEN} --failure--&gt; {@link #OPEN}
 *    any --manual reset--&gt; {@link #CLOSED}
 * </pre>
 *
 * <p>Circuits are efficiently threadsafe, even in the face of aggressive concurrency. Each uses
 * a single atomic int to track state, rather than mutexes.</p>
 */
public class Circuit {

    /**
     * The circuit is closed. Calls pass through. (This constant is enum-like, but is defined as an int to allow
     * efficient bitmasking.)
     */
    public static final int CLOSED = 0;

    /**
     * The circuit is open. Calls fail fast until the reset timeout elapses.
     */
    public static final int OPEN = 1;

    /**
     * The reset timeout has elapsed and calls are probing whether the dependency recovered.
     */
    public static final int HALF_OPEN = 2;

    /**
     * Use this constant to mask a state snapshot (see {@link #getStateSnapshot()}) into a value like
     * {@link #OPEN} or {@link #CLOSED}.
     */
    public static final int STATE_MASK = 0x03;

    // Rather than bit twiddling to update the state index, just add this much to it every time. This
    // leaves the bottom two bits alone.
    private static final int INDEX_INCREMENTER = 4;

    // This mask grabs the top 30 bits of the state snapshot.
    private static final int INDEX_MASK = ~STATE_MASK;

    /*
     * Holds both the current state, and a monotonically increasing state *index* that tells us if
     * some other party changed the state after we last fetched it. Because both live in one atomic,
     * a transition computed from a stale view simply fails its compare-and-set instead of clobbering
     * a newer state. Breakers change state rarely compared to how often they are called, so this
     * read-mostly design costs almost nothing on the hot path.
     */
    private final AtomicInteger stateSnapshot = new AtomicInteger(CLOSED);

    private final Listener listener;

    /**
     * @param listener  May be null.
     */
    public Circuit(Listener listener) {
        this.listener = listener;
    }

    /**
     * @return an opaque integer that encapsulates the current state and its change index. Mask it with
     * {@link #STATE_MASK} to get one of {@link #CLOSED}, {@link #OPEN} or {@link #HALF_OPEN}.
     */
    public int getStateSnapshot() {
        return stateSnapshot.get();
    }

    public int getState() {
        return stateSnapshot.get() & STATE_MASK;
    }

    /**
     * <p>Attempt to move the state machine to a new state.</p>
     *
     * <p>Succeeds only if the state has not changed since <code>oldSnapshot</code> was fetched. Unlike a plain
     * compare-and-set, a redundant request (the circuit is already in <code>newState</code>) is reported as
     * {@link Outcome#ALREADY}, so callers can tell whether <em>they</em> caused the change.</p>
     *
     * @param oldSnapshot  Asserts that the circuit is currently in the state described by oldSnapshot, as returned
     *                     by {@link #getStateSnapshot()}.
     * @param newState  The desired state.
     */
    public Outcome transition(int oldSnapshot, int newState) {
        int oldState = oldSnapshot & STATE_MASK;
        if (!isValidTransition(oldState, newState)) {
            throw new IllegalArgumentException(String.format("Can't transition from %s to %s.",
                    stateToString(oldState), stateToString(newState)));
        }
        if (oldState == newState) {
            return Outcome.ALREADY;
        }
        int newSnapshot = ((oldSnapshot & INDEX_MASK) + INDEX_INCREMENTER) | newState;

        // The common case: nothing invalidated our starting assumptions.
        if (stateSnapshot.compareAndSet(oldSnapshot, newSnapshot)) {
            if (listener != null) {
                listener.onCircuitTransition(this, oldState, newState);
            }
            return Outcome.CHANGED;
        }
        // Someone else got there first, but asked for the same thing.
        if ((stateSnapshot.get() & STATE_MASK) == newState) {
            return Outcome.ALREADY;
        }
        // Concurrency invalidated the caller's view of the current state.
        return Outcome.STALE;
    }

    /**
     * Set the state regardless of the state machine rules. Used for manual resets.
     *
     * @return true if the state actually changed.
     */
    boolean unsafeTransition(int newState) {
        while (true) {
            int oldSnapshot = stateSnapshot.get();
            int oldState = oldSnapshot & STATE_MASK;
            if (oldState == newState) {
                return false;
            }
            int newSnapshot = ((oldSnapshot & INDEX_MASK) + INDEX_INCREMENTER) | newState;
            if (stateSnapshot.compareAndSet(oldSnapshot, newSnapshot)) {
                if (listener != null) {
                    listener.onCircuitTransition(this, oldState, newState);
                }
                return true;
            }
        }
    }

    /**
     * @return true if the old and new states are valid for our state machine. {@link #OPEN} to {@link #CLOSED}
     * is not valid because the circuit must pass through {@link #HALF_OPEN} first (except via manual reset).
     */
    public static boolean isValidTransition(int oldStateOrSnapshot, int newStateOrSnapshot) {
        int newState = newStateOrSnapshot & STATE_MASK;
        switch (oldStateOrSnapshot & STATE_MASK) {
            case CLOSED:
                return newState == OPEN || newState == CLOSED;
            case OPEN:
                return newState == HALF_OPEN || newState == OPEN;
            case HALF_OPEN:
                return newState == CLOSED || newState == OPEN || newState == HALF_OPEN;
            default:
                return false;
        }
    }

    /**
     * Converts a state constant such as {@link #CLOSED} to a string such as "CLOSED".
     */
    public static String stateToString(int state) {
        return toEnum(state).name();
    }

    public static CircuitBreakerState toEnum(int state) {
        switch (state & STATE_MASK) {
            case CLOSED: return CircuitBreakerState.CLOSED;
            case OPEN: return CircuitBreakerState.OPEN;
            case HALF_OPEN: return CircuitBreakerState.HALF_OPEN;
            default: throw new IllegalArgumentException(String.format("Unrecognized state %d.", state));
        }
    }

    /**
     * What happened to a {@link #transition(int, int)} request.
     */
    public enum Outcome {
        /** This call changed the state. */
        CHANGED,
        /** The circuit was already in the requested state. */
        ALREADY,
        /** The state changed underneath the caller; re-fetch and re-evaluate. */
        STALE
    }

    /**
     * Receive notifications just after the circuit changes state. Processing these events should be very fast
     * and light, to avoid bogging down the circuit breaker.
     */
    public interface Listener {
        void onCircuitTransition(Circuit circuit, int oldState, int newState);
    }
}
