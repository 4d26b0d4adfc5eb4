package com.etcd.coordination.instrument;

/**
 * Observer of client operations. Every public operation calls {@link #onStart}
 * before it touches the store and {@link #onFinish} exactly once afterwards,
 * whichever way it ends.
 *
 * <p>Listeners run on the caller's thread. Exceptions they throw are logged and
 * ignored; they cannot change the outcome of the operation.</p>
 */
public interface CallListener {

    default void onStart(CallInfo call) {
    }

    /**
     * @param call   the call that started earlier
     * @param status {@code "0"} for a successful store call, a store error classifier,
     *               or one of the lock/memoize statuses in {@link CallStatus}
     */
    default void onFinish(CallInfo call, String status) {
    }

    /**
     * Called once the listener is unregistered. Calls still in flight will not
     * deliver their finish event to this listener.
     */
    default void onRemoved() {
    }
}
