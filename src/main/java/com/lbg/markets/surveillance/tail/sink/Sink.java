package com.lbg.markets.surveillance.tail.sink;

import com.lbg.markets.surveillance.tail.domain.Entry;

/**
 * Downstream consumer of records. Called synchronously; a reader does not move past a
 * record until {@code emit} returns. Throwing leaves the record to be read again.
 */
@FunctionalInterface
public interface Sink {
    void emit(Entry entry);
}
