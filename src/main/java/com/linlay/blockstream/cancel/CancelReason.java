package com.linlay.blockstream.cancel;

public enum CancelReason {

    /**
     * No raw event arrived within the configured idle window.
     */
    IDLE_TIMEOUT,

    /**
     * The caller (user stop, shutdown, subscriber cancel) asked to stop.
     */
    CALLER,

    /**
     * The provider itself reported an abort in-band.
     */
    PROVIDER_ABORT
}
