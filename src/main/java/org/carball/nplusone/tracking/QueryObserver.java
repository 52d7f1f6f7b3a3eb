package org.carball.nplusone.tracking;

import org.carball.nplusone.model.QueryEvent;

/**
 * Called synchronously by the data-access layer for every executed statement,
 * on the thread that executed it.
 */
@FunctionalInterface
public interface QueryObserver {

    void onQueryObserved(QueryEvent event);
}
