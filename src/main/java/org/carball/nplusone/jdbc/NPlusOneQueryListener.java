package org.carball.nplusone.jdbc;

import lombok.extern.slf4j.Slf4j;
import net.ttddyy.dsproxy.ExecutionInfo;
import net.ttddyy.dsproxy.QueryInfo;
import net.ttddyy.dsproxy.listener.QueryExecutionListener;
import net.ttddyy.dsproxy.support.ProxyDataSourceBuilder;
import org.carball.nplusone.model.Dialect;
import org.carball.nplusone.model.QueryEvent;
import org.carball.nplusone.tracking.QueryObserver;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.List;

/**
 * datasource-proxy listener that forwards every executed statement to a {@link QueryObserver}
 * together with the stack of the thread that executed it.
 *
 * <p>Register it on a proxied {@code DataSource}, most simply through {@link #wrap(DataSource, QueryObserver)}.
 * Batched statements are forwarded one event per query.
 */
@Slf4j
public class NPlusOneQueryListener implements QueryExecutionListener {

    static final String PROXY_NAME = "nplusone";

    private final QueryObserver observer;
    private final Dialect dialect;

    public NPlusOneQueryListener(QueryObserver observer, Dialect dialect) {
        this.observer = observer;
        this.dialect = dialect;
    }

    /**
     * Proxies {@code dataSource} so that its statements reach {@code observer}.
     * The dialect is read from the database metadata once, up front.
     */
    public static DataSource wrap(DataSource dataSource, QueryObserver observer) throws SQLException {
        Dialect dialect = DialectDetector.detect(dataSource);
        log.info("Tracking queries on {} data source", dialect);

        return ProxyDataSourceBuilder.create(dataSource)
                .name(PROXY_NAME)
                .listener(new NPlusOneQueryListener(observer, dialect))
                .build();
    }

    @Override
    public void beforeQuery(ExecutionInfo execInfo, List<QueryInfo> queryInfoList) {
        // Only completed statements are reported
    }

    @Override
    public void afterQuery(ExecutionInfo execInfo, List<QueryInfo> queryInfoList) {
        List<String> callStack = CallStackCapture.capture();

        for (QueryInfo queryInfo : queryInfoList) {
            observer.onQueryObserved(new QueryEvent(queryInfo.getQuery(), dialect, false, null, callStack));
        }
    }

    public Dialect getDialect() {
        return dialect;
    }
}
