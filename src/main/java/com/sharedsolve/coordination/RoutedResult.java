package com.sharedsolve.coordination;

import com.sharedsolve.extraction.ComponentResult;

import java.time.Duration;

public record RoutedResult(ComponentResult result, ResultSource source, Duration waited) {

    public static RoutedResult generated(ComponentResult result) {
        return new RoutedResult(result, ResultSource.GENERATED, Duration.ZERO);
    }

    public boolean shared() {
        return source == ResultSource.SHARED;
    }
}
