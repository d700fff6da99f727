package dk.cloudcreate.aggregatestore.common.transaction;

import java.util.*;

class RecordingUnitOfWork implements UnitOfWork {
    final String        name;
    final List<String>  flushLog;
    boolean             requiresFlush;
    RuntimeException    failure;
    Runnable            onFlush;
    int                 flushCount;

    RecordingUnitOfWork(String name, List<String> flushLog, boolean requiresFlush) {
        this.name = name;
        this.flushLog = flushLog;
        this.requiresFlush = requiresFlush;
    }

    @Override
    public boolean requiresFlush() {
        return requiresFlush;
    }

    @Override
    public void flush() {
        flushCount++;
        flushLog.add(name);
        if (onFlush != null) {
            onFlush.run();
        }
        if (failure != null) {
            throw failure;
        }
    }
}
