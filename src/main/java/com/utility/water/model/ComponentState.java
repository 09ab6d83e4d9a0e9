package com.utility.water.model;

public enum ComponentState {
    /** Fitted on the current series. */
    TRAINED,
    /** Latest fit failed; the last known good model is still serving. */
    CARRIED_OVER,
    /** No usable model; callers use the component's fallback. */
    FAILED
}
