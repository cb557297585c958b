package com.planwatch.core.classify;

/**
 * Anything that can show a {@link DisplayAction}: the console, a test recorder, a UI.
 * Called from more than one thread; implementations must tolerate that.
 */
@FunctionalInterface
public interface DisplayRenderer {

    void render(DisplayAction action);
}
