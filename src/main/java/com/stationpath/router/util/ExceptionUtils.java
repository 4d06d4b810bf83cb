package com.stationpath.router.util;

import com.google.common.base.Throwables;
import com.google.common.collect.Lists;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Convenience functions for reporting exceptions (or more generally throwables) to the user.
 */
public abstract class ExceptionUtils {

    /** The usual Java stack trace, covering the whole chain of causes. */
    public static String stackTraceString (Throwable throwable) {
        return Throwables.getStackTraceAsString(throwable);
    }

    /**
     * One line summary of the chain of causes, with the root cause first, e.g.
     * "SQLException: no such table: stops, caused ScheduleStoreException: Could not read stops".
     */
    public static String shortCauseString (Throwable throwable) {
        List<Throwable> chain = Lists.reverse(Throwables.getCausalChain(throwable));
        return chain.stream().map(ExceptionUtils::describe).collect(Collectors.joining(", caused "));
    }

    private static String describe (Throwable throwable) {
        String item = throwable.getClass().getSimpleName();
        if (throwable.getMessage() != null) {
            item += ": " + throwable.getMessage();
        }
        return item;
    }

}
