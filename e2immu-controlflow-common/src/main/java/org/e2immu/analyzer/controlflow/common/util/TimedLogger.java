package org.e2immu.analyzer.controlflow.common.util;

import org.slf4j.Logger;

import java.util.concurrent.atomic.AtomicLong;

/*
logs at INFO level, but at most once per interval; used to report progress of long-running loops
 */
public class TimedLogger {
    private final Logger logger;
    private final long intervalMillis;
    private final AtomicLong lastLogged = new AtomicLong();

    public TimedLogger(Logger logger, long intervalMillis) {
        this.logger = logger;
        this.intervalMillis = intervalMillis;
    }

    public void info(String format, Object... arguments) {
        long now = System.currentTimeMillis();
        long last = lastLogged.get();
        if (now - last >= intervalMillis && lastLogged.compareAndSet(last, now)) {
            logger.info(format, arguments);
        }
    }
}
