package com.edgelet.internal.microhttp;

/**
 * Handle returned by {@link Scheduler} for cancelling a scheduled task.
 */
interface Cancellable {

    void cancel();

}
