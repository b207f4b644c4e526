package com.algotrendy.gateway.persistence;

import com.algotrendy.gateway.bars.Bar;
import com.algotrendy.gateway.bars.BarType;

import java.util.List;

/**
 * Store for completed tick, range and Renko bars.
 */
public interface BarRepository extends AutoCloseable {

    /**
     * Persist bars in one transaction. A bar with the same symbol, type, source and
     * close time replaces the stored one.
     *
     * @return number of bars written
     */
    int save(List<? extends Bar> bars);

    /**
     * Most recent bars of one type, newest first.
     */
    List<StoredBar> findRecent(String symbol, BarType barType, int limit);

    @Override
    void close();
}
